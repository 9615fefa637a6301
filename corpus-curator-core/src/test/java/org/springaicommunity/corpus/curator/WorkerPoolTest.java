package org.springaicommunity.corpus.curator;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.*;

@DisplayName("WorkerPool Tests")
class WorkerPoolTest {

	@Nested
	@DisplayName("Execution Tests")
	class ExecutionTest {

		@Test
		@DisplayName("Should produce one outcome per item")
		void shouldProduceOneOutcomePerItem() {
			List<Integer> items = IntStream.range(0, 25).boxed().toList();

			List<WorkOutcome<Integer, Integer>> outcomes = new WorkerPool(4).run(items, i -> i * 2);

			assertThat(outcomes).hasSize(25);
			assertThat(outcomes).allMatch(outcome -> outcome instanceof WorkOutcome.Completed);
			assertThat(outcomes.stream()
				.map(outcome -> ((WorkOutcome.Completed<Integer, Integer>) outcome).result())
				.sorted()
				.toList()).isEqualTo(items.stream().map(i -> i * 2).toList());
		}

		@Test
		@DisplayName("Should never run more items than the concurrency limit")
		void shouldBoundConcurrency() {
			AtomicInteger running = new AtomicInteger();
			AtomicInteger peak = new AtomicInteger();
			List<Integer> items = IntStream.range(0, 20).boxed().toList();

			new WorkerPool(3).run(items, i -> {
				int now = running.incrementAndGet();
				peak.accumulateAndGet(now, Math::max);
				Thread.sleep(10);
				running.decrementAndGet();
				return i;
			});

			assertThat(peak.get()).isBetween(1, 3);
		}

		@Test
		@DisplayName("Should isolate failing items")
		void shouldIsolateFailures() {
			List<Integer> items = IntStream.range(0, 10).boxed().toList();

			List<WorkOutcome<Integer, Integer>> outcomes = new WorkerPool(2).run(items, i -> {
				if (i % 3 == 0) {
					throw new IOException("cannot read " + i);
				}
				return i;
			});

			List<Integer> failed = outcomes.stream()
				.filter(outcome -> outcome instanceof WorkOutcome.Failed)
				.map(WorkOutcome::item)
				.sorted()
				.toList();
			assertThat(failed).containsExactly(0, 3, 6, 9);
			assertThat(outcomes).hasSize(10);
			WorkOutcome.Failed<Integer, Integer> first = (WorkOutcome.Failed<Integer, Integer>) outcomes.stream()
				.filter(outcome -> outcome instanceof WorkOutcome.Failed)
				.findFirst()
				.orElseThrow();
			assertThat(first.cause()).isInstanceOf(IOException.class).hasMessageStartingWith("cannot read");
		}

		@Test
		@DisplayName("Should log worker failures with their stack trace")
		void shouldLogFailureWithStackTrace() {
			Logger poolLogger = (Logger) LoggerFactory.getLogger(WorkerPool.class);
			ListAppender<ILoggingEvent> appender = new ListAppender<>();
			appender.start();
			poolLogger.addAppender(appender);
			try {
				new WorkerPool(1).run(List.of("batch_7.jsonl"), file -> {
					throw new IOException("disk error");
				});
			}
			finally {
				poolLogger.detachAppender(appender);
			}

			assertThat(appender.list).hasSize(1);
			ILoggingEvent event = appender.list.get(0);
			assertThat(event.getLevel()).isEqualTo(Level.ERROR);
			assertThat(event.getFormattedMessage()).isEqualTo("Worker error for batch_7.jsonl");
			assertThat(event.getThrowableProxy()).isNotNull();
			assertThat(event.getThrowableProxy().getClassName()).isEqualTo(IOException.class.getName());
			assertThat(event.getThrowableProxy().getMessage()).isEqualTo("disk error");
		}

		@Test
		@DisplayName("Should deliver outcomes on the calling thread")
		void shouldDeliverOutcomesOnCallingThread() {
			Thread caller = Thread.currentThread();
			List<Thread> callbackThreads = new ArrayList<>();

			new WorkerPool(4).<Integer, String>run(List.of(1, 2, 3, 4, 5), i -> Thread.currentThread().getName(),
					outcome -> callbackThreads.add(Thread.currentThread()));

			assertThat(callbackThreads).hasSize(5).containsOnly(caller);
		}

		@Test
		@DisplayName("Should run workers on named pool threads")
		void shouldUseNamedThreads() {
			List<WorkOutcome<Integer, String>> outcomes = new WorkerPool(2).run(List.of(1, 2),
					i -> Thread.currentThread().getName());

			assertThat(outcomes).allSatisfy(outcome -> {
				String threadName = ((WorkOutcome.Completed<Integer, String>) outcome).result();
				assertThat(threadName).startsWith("curator-").contains("-worker-");
			});
		}

		@Test
		@DisplayName("Should return immediately for no items")
		void shouldHandleNoItems() {
			assertThat(new WorkerPool(2).run(List.<Integer>of(), i -> i)).isEmpty();
		}

		@Test
		@DisplayName("Should reject non-positive concurrency")
		void shouldRejectNonPositiveConcurrency() {
			assertThatThrownBy(() -> new WorkerPool(0)).isInstanceOf(IllegalArgumentException.class);
		}

	}

	@Nested
	@DisplayName("Wave Tests")
	class WaveTest {

		@Test
		@DisplayName("Should split items into ordered waves")
		void shouldSplitIntoWaves() {
			List<List<Integer>> waves = WorkerPool.waves(List.of(1, 2, 3, 4, 5, 6, 7), 3);

			assertThat(waves).containsExactly(List.of(1, 2, 3), List.of(4, 5, 6), List.of(7));
		}

		@Test
		@DisplayName("Should return no waves for no items")
		void shouldReturnNoWaves() {
			assertThat(WorkerPool.waves(List.of(), 5)).isEmpty();
		}

		@Test
		@DisplayName("Should reject non-positive wave size")
		void shouldRejectNonPositiveWaveSize() {
			assertThatThrownBy(() -> WorkerPool.waves(List.of(1), 0)).isInstanceOf(IllegalArgumentException.class);
		}

	}

}
