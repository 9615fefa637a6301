package org.springaicommunity.corpus.curator;

/**
 * Result of one work item run by the {@link WorkerPool}.
 *
 * @param <T> work item type
 * @param <R> result type
 */
public sealed interface WorkOutcome<T, R> permits WorkOutcome.Completed, WorkOutcome.Failed {

	T item();

	/**
	 * The item finished and produced a result.
	 *
	 * @param item the work item
	 * @param result the worker's result
	 */
	record Completed<T, R>(T item, R result) implements WorkOutcome<T, R> {
	}

	/**
	 * The worker threw.
	 *
	 * @param item the work item
	 * @param cause the failure
	 */
	record Failed<T, R>(T item, Throwable cause) implements WorkOutcome<T, R> {
	}

}
