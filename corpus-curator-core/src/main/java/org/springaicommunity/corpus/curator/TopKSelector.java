package org.springaicommunity.corpus.curator;

import java.util.ArrayList;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Bounded collection of the {@code k} entries with the largest
 * {@link TopKEntry#contentLength()}.
 *
 * <p>
 * Backed by a min-heap of at most {@code k} entries. Once the heap is full its smallest
 * length is the admission threshold: a candidate whose length does not exceed it is
 * rejected without touching the heap. Entries with a non-positive length are never
 * admitted.
 *
 * <p>
 * {@link #merge(TopKSelector)} admits every entry of another selector, so the top-K of a
 * union can be computed from the top-K of its parts in any order. Not thread-safe; each
 * worker owns its own selector and only the coordinator merges.
 */
public class TopKSelector {

	private final int k;

	private final PriorityQueue<TopKEntry> heap;

	private long threshold = 0;

	public TopKSelector(int k) {
		if (k < 0) {
			throw new IllegalArgumentException("k must not be negative: " + k);
		}
		this.k = k;
		this.heap = new PriorityQueue<>(Math.max(1, k), TopKEntry.LARGEST_FIRST.reversed());
	}

	/**
	 * Offer a candidate.
	 * @param entry the candidate
	 * @return true if the entry was retained
	 */
	public boolean admit(TopKEntry entry) {
		if (k == 0 || entry.contentLength() <= threshold) {
			return false;
		}
		heap.add(entry);
		if (heap.size() > k) {
			heap.poll();
		}
		if (heap.size() == k) {
			threshold = heap.peek().contentLength();
		}
		return true;
	}

	/**
	 * Admit every entry of {@code other}; {@code other} is left unchanged.
	 * @param other selector to merge in
	 * @return this selector
	 */
	public TopKSelector merge(TopKSelector other) {
		for (TopKEntry entry : other.heap) {
			admit(entry);
		}
		return this;
	}

	/**
	 * Returns the retained entries, largest first.
	 * @return a new sorted list
	 */
	public List<TopKEntry> entries() {
		List<TopKEntry> sorted = new ArrayList<>(heap);
		sorted.sort(TopKEntry.LARGEST_FIRST);
		return sorted;
	}

	/**
	 * Returns the length a candidate must exceed to be admitted; 0 until the selector is
	 * full.
	 * @return current admission threshold
	 */
	public long threshold() {
		return threshold;
	}

	public int size() {
		return heap.size();
	}

	public int capacity() {
		return k;
	}

	public boolean isFull() {
		return heap.size() == k;
	}

}
