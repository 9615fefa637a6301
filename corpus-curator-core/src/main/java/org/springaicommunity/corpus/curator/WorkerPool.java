package org.springaicommunity.corpus.curator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Runs one work item per worker thread with bounded concurrency.
 *
 * <p>
 * At most {@code concurrency} items run at once. Whenever an item finishes, successfully
 * or not, the calling thread receives its {@link WorkOutcome} and immediately submits the
 * next queued item. A failing item is logged and reported; it never stops the pool.
 * Outcome callbacks run on the calling thread only, so callers may aggregate into plain
 * collections without synchronization.
 *
 * <pre>
 * {@code
 * WorkerPool pool = new WorkerPool(4);
 * List<WorkOutcome<Path, CleaningStats>> outcomes = pool.run(files, file -> transformer.transform(file, out));
 * }
 * </pre>
 */
public class WorkerPool {

	private static final Logger logger = LoggerFactory.getLogger(WorkerPool.class);

	private static final AtomicInteger POOL_SEQUENCE = new AtomicInteger();

	private final int concurrency;

	public WorkerPool(int concurrency) {
		if (concurrency < 1) {
			throw new IllegalArgumentException("Concurrency must be positive: " + concurrency);
		}
		this.concurrency = concurrency;
	}

	/**
	 * Work performed for one item on a worker thread.
	 *
	 * @param <T> item type
	 * @param <R> result type
	 */
	@FunctionalInterface
	public interface Worker<T, R> {

		R process(T item) throws Exception;

	}

	public int concurrency() {
		return concurrency;
	}

	/**
	 * Run every item and collect the outcomes in completion order.
	 * @param items work items
	 * @param worker work to run per item
	 * @return one outcome per item
	 */
	public <T, R> List<WorkOutcome<T, R>> run(List<T> items, Worker<T, R> worker) {
		List<WorkOutcome<T, R>> outcomes = new ArrayList<>(items.size());
		run(items, worker, outcomes::add);
		return outcomes;
	}

	/**
	 * Run every item, handing each outcome to {@code onOutcome} on the calling thread as
	 * soon as it is available. Returns once all items have completed or failed.
	 * @param items work items
	 * @param worker work to run per item
	 * @param onOutcome outcome consumer, invoked on the calling thread
	 */
	public <T, R> void run(List<T> items, Worker<T, R> worker, Consumer<WorkOutcome<T, R>> onOutcome) {
		if (items.isEmpty()) {
			return;
		}

		int threads = Math.min(concurrency, items.size());
		ExecutorService executor = Executors.newFixedThreadPool(threads, namedThreads());
		CompletionService<WorkOutcome<T, R>> completion = new ExecutorCompletionService<>(executor);
		Iterator<T> queue = items.iterator();
		int inFlight = 0;

		try {
			for (int i = 0; i < threads; i++) {
				submit(completion, queue.next(), worker);
				inFlight++;
			}

			while (inFlight > 0) {
				WorkOutcome<T, R> outcome = takeNext(completion);
				inFlight--;
				if (queue.hasNext()) {
					submit(completion, queue.next(), worker);
					inFlight++;
				}
				onOutcome.accept(outcome);
			}
		}
		finally {
			executor.shutdown();
		}
	}

	/**
	 * Split {@code items} into consecutive waves of at most {@code waveSize} items.
	 * @param items items to split
	 * @param waveSize maximum items per wave
	 * @return list of waves preserving item order
	 */
	public static <T> List<List<T>> waves(List<T> items, int waveSize) {
		if (waveSize < 1) {
			throw new IllegalArgumentException("Wave size must be positive: " + waveSize);
		}
		List<List<T>> waves = new ArrayList<>();
		for (int start = 0; start < items.size(); start += waveSize) {
			waves.add(List.copyOf(items.subList(start, Math.min(items.size(), start + waveSize))));
		}
		return waves;
	}

	private static <T, R> void submit(CompletionService<WorkOutcome<T, R>> completion, T item, Worker<T, R> worker) {
		completion.submit(() -> {
			try {
				return new WorkOutcome.Completed<>(item, worker.process(item));
			}
			catch (Exception e) {
				logger.error("Worker error for {}", item, e);
				return new WorkOutcome.Failed<>(item, e);
			}
		});
	}

	private static <T, R> WorkOutcome<T, R> takeNext(CompletionService<WorkOutcome<T, R>> completion) {
		try {
			Future<WorkOutcome<T, R>> done = completion.take();
			return done.get();
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new IllegalStateException("Interrupted while waiting for workers", e);
		}
		catch (ExecutionException e) {
			// Exceptions become outcomes in submit(); only errors get here
			throw new IllegalStateException("Unexpected worker failure", e.getCause());
		}
	}

	private static ThreadFactory namedThreads() {
		int pool = POOL_SEQUENCE.incrementAndGet();
		AtomicInteger thread = new AtomicInteger();
		return runnable -> {
			Thread t = new Thread(runnable, "curator-" + pool + "-worker-" + thread.incrementAndGet());
			t.setDaemon(true);
			return t;
		};
	}

}
