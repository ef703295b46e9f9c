package com.github.behaviouractor.examples.chart;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;


/**
 * Chart state. Every series keeps a window of at most {@code maxPoints} most recent points and
 * all series share the same x counter, so a point appended to any series advances x by one.
 * Not thread safe, owned by a single actor.
 */
public class ChartModel {

	public static final class Point {

		private final long x;
		private final double y;

		public Point(final long x, final double y) {
			this.x = x;
			this.y = y;
		}

		public long getX() {
			return x;
		}

		public double getY() {
			return y;
		}

		@Override
		public int hashCode() {
			return Long.hashCode(x) * 31 + Double.hashCode(y);
		}

		@Override
		public boolean equals(final Object obj) {
			if (this == obj) {
				return true;
			}
			if (!(obj instanceof Point)) {
				return false;
			}
			final var other = (Point) obj;
			return x == other.x && Double.compare(y, other.y) == 0;
		}

		@Override
		public String toString() {
			return "(" + x + ", " + y + ")";
		}
	}

	private final Map<String, Deque<Point>> series = new LinkedHashMap<>();
	private final int maxPoints;
	private long x = 0;

	public ChartModel(final int maxPoints) {
		if (maxPoints < 1) {
			throw new IllegalArgumentException("Max points must be positive, got " + maxPoints);
		}
		this.maxPoints = maxPoints;
	}

	/**
	 * @param name the series name
	 * @return True if series has been added, false if it already existed
	 */
	public boolean addSeries(final String name) {
		if (series.containsKey(name)) {
			return false;
		}
		series.put(name, new ArrayDeque<>(maxPoints));
		return true;
	}

	/**
	 * @param name the series name
	 * @return True if series has been removed, false if it did not exist
	 */
	public boolean removeSeries(final String name) {
		return series.remove(name) != null;
	}

	/**
	 * Append point to the series, evicting the oldest one when window is full.
	 *
	 * @param name the series name
	 * @param y the point value
	 * @return True if point has been appended, false if there is no such series
	 */
	public boolean append(final String name, final double y) {

		final var points = series.get(name);
		if (points == null) {
			return false;
		}

		if (points.size() == maxPoints) {
			points.pollFirst();
		}

		points.offerLast(new Point(x++, y));

		return true;
	}

	public List<Point> points(final String name) {
		final var points = series.get(name);
		if (points == null) {
			return List.of();
		}
		return new ArrayList<>(points);
	}

	public Set<String> series() {
		return Set.copyOf(series.keySet());
	}

	public long nextX() {
		return x;
	}
}
