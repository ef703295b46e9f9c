package com.github.behaviouractor.runner;

import org.openjdk.jmh.results.format.ResultFormatType;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;


public final class BenchmarkRunner {

	private BenchmarkRunner() {
	}

	/**
	 * Run benchmarks of a given class and store results in the results directory.
	 *
	 * @param clazz the benchmark class
	 * @throws RunnerException when benchmark fails
	 */
	public static void run(final Class<?> clazz) throws RunnerException {

		final String name = clazz.getSimpleName();

		final Options opt = new OptionsBuilder()
			.include(".*\\." + name + "\\..*")
			.resultFormat(ResultFormatType.TEXT)
			.result("results/" + name + ".txt")
			.shouldDoGC(true)
			.forks(1)
			.build();

		new Runner(opt).run();
	}
}
