package com.github.behaviouractor;

import java.util.function.Consumer;
import java.util.function.Predicate;


/**
 * An immutable, named set of message handlers (a behaviour). Every registration consists of the
 * message type, an optional guard predicate and the action to invoke. Registrations are kept in
 * the exact order they were declared in the {@link ReceiveBuilder}, because the {@link Dispatcher}
 * uses this order as the only way to decide which of the registrations sharing the same type
 * should handle the message.
 * <p>
 *
 * Instances are created once per behaviour and never modified afterwards, so they can be safely
 * pushed on the {@link BehaviourStack}, compared in tests and printed for diagnostics.
 */
public final class Receive {

	private static final Matcher[] NO_MATCHERS = new Matcher[0];

	private final String name;
	private final Matcher[] matchers;

	Receive(final String name, final Matcher[] matchers) {
		this.name = name;
		this.matchers = matchers;
	}

	/**
	 * Start building new behaviour with a given name.
	 *
	 * @param name the behaviour name
	 * @return New {@link ReceiveBuilder}
	 */
	public static ReceiveBuilder builder(final String name) {
		return new ReceiveBuilder(name);
	}

	/**
	 * @param name the behaviour name
	 * @return Behaviour which does not handle any message
	 */
	public static Receive empty(final String name) {
		return new Receive(name, NO_MATCHERS);
	}

	public String name() {
		return name;
	}

	/**
	 * @return How many registrations this behaviour has
	 */
	public int size() {
		return matchers.length;
	}

	Matcher[] matchers() {
		return matchers;
	}

	@Override
	public String toString() {
		return new StringBuilder(getClass().getSimpleName())
			.append("[ name = ")
			.append(name)
			.append(", size = ")
			.append(matchers.length)
			.append(" ]")
			.toString();
	}

	/**
	 * Single registration. The guard is null when registration accepts every message of a matching
	 * type.
	 */
	static final class Matcher {

		final Class<?> type;
		final Predicate<Object> guard;
		final Consumer<Object> action;

		Matcher(final Class<?> type, final Predicate<Object> guard, final Consumer<Object> action) {
			this.type = type;
			this.guard = guard;
			this.action = action;
		}

		boolean accepts(final Object message) {
			return type.isInstance(message) && (guard == null || guard.test(message));
		}
	}
}
