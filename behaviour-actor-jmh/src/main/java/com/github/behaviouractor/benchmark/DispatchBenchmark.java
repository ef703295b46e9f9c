package com.github.behaviouractor.benchmark;

import java.util.concurrent.TimeUnit;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;
import org.openjdk.jmh.runner.RunnerException;

import com.github.behaviouractor.Dispatcher;
import com.github.behaviouractor.Receive;
import com.github.behaviouractor.runner.BenchmarkRunner;


/**
 * Dispatch cost of the last registration in behaviours of growing size. Every registration but the
 * last one has the same type as the message and a guard which rejects it.
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Warmup(iterations = 5, time = 100, timeUnit = TimeUnit.MILLISECONDS)
@Measurement(iterations = 5, time = 100, timeUnit = TimeUnit.MILLISECONDS)
public class DispatchBenchmark {

	public static void main(String[] args) throws RunnerException {
		BenchmarkRunner.run(DispatchBenchmark.class);
	}

	@State(Scope.Thread)
	public static class Context {

		@Param({ "1", "4", "16", "64" })
		int size;

		Receive guarded;
		Receive typed;
		Integer message;
		Blackhole blackhole;

		@Setup(Level.Trial)
		public void setup(final Blackhole blackhole) {

			this.blackhole = blackhole;
			this.message = Integer.valueOf(size);

			final var g = Receive.builder("guarded");
			for (int i = 0; i < size - 1; i++) {
				final var rejected = Integer.valueOf(-i - 1);
				g.match(Integer.class, rejected::equals, blackhole::consume);
			}
			guarded = g
				.match(Integer.class, blackhole::consume)
				.build();

			final var t = Receive.builder("typed");
			for (int i = 0; i < size - 1; i++) {
				t.match(String.class, blackhole::consume);
			}
			typed = t
				.match(Integer.class, blackhole::consume)
				.build();
		}
	}

	@Benchmark
	public Dispatcher.Outcome guarded(final Context context) {
		return Dispatcher.dispatch(context.guarded, context.message);
	}

	@Benchmark
	public Dispatcher.Outcome typed(final Context context) {
		return Dispatcher.dispatch(context.typed, context.message);
	}
}
