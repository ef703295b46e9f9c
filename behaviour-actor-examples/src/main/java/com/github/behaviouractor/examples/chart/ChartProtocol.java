package com.github.behaviouractor.examples.chart;

import static java.util.Objects.requireNonNull;

import java.util.List;

import com.github.behaviouractor.examples.chart.ChartModel.Point;


/**
 * Messages understood by the {@link ChartingActor} and the updates it sends to the chart sink.
 */
public interface ChartProtocol {

	final class AddSeries {

		private final String name;

		public AddSeries(final String name) {
			this.name = requireNonNull(name, "Series name must not be null");
		}

		public String getName() {
			return name;
		}

		@Override
		public String toString() {
			return getClass().getSimpleName() + "[" + name + "]";
		}
	}

	final class RemoveSeries {

		private final String name;

		public RemoveSeries(final String name) {
			this.name = requireNonNull(name, "Series name must not be null");
		}

		public String getName() {
			return name;
		}

		@Override
		public String toString() {
			return getClass().getSimpleName() + "[" + name + "]";
		}
	}

	final class Metric {

		private final String series;
		private final double value;

		public Metric(final String series, final double value) {
			this.series = requireNonNull(series, "Series name must not be null");
			this.value = value;
		}

		public String getSeries() {
			return series;
		}

		public double getValue() {
			return value;
		}

		@Override
		public String toString() {
			return new StringBuilder()
				.append(getClass().getSimpleName())
				.append('[')
				.append(series)
				.append('=')
				.append(value)
				.append(']')
				.toString();
		}
	}

	final class TogglePause {

		public static final TogglePause INSTANCE = new TogglePause();

		private TogglePause() {
		}

		@Override
		public String toString() {
			return getClass().getSimpleName();
		}
	}

	/**
	 * Current point window of a series. Removed series is announced with no points.
	 */
	final class ChartUpdate {

		private final String series;
		private final List<Point> points;

		public ChartUpdate(final String series, final List<Point> points) {
			this.series = requireNonNull(series, "Series name must not be null");
			this.points = List.copyOf(points);
		}

		public String getSeries() {
			return series;
		}

		public List<Point> getPoints() {
			return points;
		}

		@Override
		public String toString() {
			return new StringBuilder()
				.append(getClass().getSimpleName())
				.append('[')
				.append(series)
				.append(", ")
				.append(points)
				.append(']')
				.toString();
		}
	}
}
