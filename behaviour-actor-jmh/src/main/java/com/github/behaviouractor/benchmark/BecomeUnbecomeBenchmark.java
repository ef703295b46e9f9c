package com.github.behaviouractor.benchmark;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.openjdk.jmh.annotations.AuxCounters;
import org.openjdk.jmh.annotations.AuxCounters.Type;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.TearDown;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.runner.RunnerException;

import com.github.behaviouractor.Actor;
import com.github.behaviouractor.ActorSystem;
import com.github.behaviouractor.Props;
import com.github.behaviouractor.Receive;
import com.github.behaviouractor.dsl.Base;
import com.github.behaviouractor.dsl.Behaviours;
import com.github.behaviouractor.runner.BenchmarkRunner;


/**
 * Ping-pong between two actors where every delivery switches behaviour. Each actor stacks the
 * "up" behaviour on odd deliveries and goes back to "down" on even ones, so the runtime applies one
 * behaviour switch per message.
 */
@OutputTimeUnit(TimeUnit.SECONDS)
@Warmup(iterations = 5, time = 100, timeUnit = TimeUnit.MILLISECONDS)
@Measurement(iterations = 5, time = 100, timeUnit = TimeUnit.MILLISECONDS)
public class BecomeUnbecomeBenchmark {

	public static void main(String[] args) throws RunnerException {
		BenchmarkRunner.run(BecomeUnbecomeBenchmark.class);
	}

	static final int MESSAGES_COUNT = 100;
	static final int EXPECTED_DELIVERIES_COUNT = 1_000_000;
	static final String DONE = "done";

	@AuxCounters(Type.OPERATIONS)
	@State(Scope.Thread)
	public static class SwitchCounter {

		public long switches;

		@Setup(Level.Iteration)
		public void clean() {
			switches = 0;
		}
	}

	@State(Scope.Thread)
	public static class Context {

		ActorSystem system;
		CountDownLatch latch;

		@Setup(Level.Iteration)
		public void setupIteration() {
			system = ActorSystem.create("perf-become-unbecome");
		}

		@TearDown(Level.Iteration)
		public void teardown() {
			system.shutdown();
		}

		@Setup(Level.Invocation)
		public void setupInvocation() {
			latch = new CountDownLatch(2);
		}
	}

	@Benchmark
	public void benchmark(final SwitchCounter counter, final Context context) throws InterruptedException {

		final var system = context.system;
		final var latch = context.latch;

		final var ref1 = system.actorOf(Props.create(() -> new SwitchingActor(counter, latch)));
		final var ref2 = system.actorOf(Props.create(() -> new SwitchingActor(counter, latch)));

		for (int i = 0; i < MESSAGES_COUNT; i++) {
			final var a = i % 2 == 0 ? ref1 : ref2;
			final var b = i % 2 == 0 ? ref2 : ref1;
			a.tell(Integer.valueOf(i), b);
		}

		latch.await();
	}

	static class SwitchingActor extends Actor implements Base, Behaviours {

		final SwitchCounter counter;
		final CountDownLatch blocker;
		long count = 0;

		final Receive up = behaviour("up")
			.matchEquals(DONE, d -> stop())
			.match(Integer.class, this::onDown)
			.build();

		SwitchingActor(final SwitchCounter counter, final CountDownLatch blocker) {
			this.counter = counter;
			this.blocker = blocker;
		}

		@Override
		public Receive receive() {
			return behaviour("down")
				.matchEquals(DONE, d -> stop())
				.match(Integer.class, this::onUp)
				.build();
		}

		private void onUp(final Integer i) {
			becomeStacked(up);
			next(i);
		}

		private void onDown(final Integer i) {
			unbecome();
			next(i);
		}

		private void next(final Integer i) {
			if (count++ >= EXPECTED_DELIVERIES_COUNT) {
				reply(DONE);
				stop();
			} else {
				reply(i);
			}
		}

		@Override
		public void postStop() {
			synchronized (counter) {
				counter.switches += count;
			}
			blocker.countDown();
		}
	}
}
