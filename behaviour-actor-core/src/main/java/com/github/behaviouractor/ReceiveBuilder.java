package com.github.behaviouractor;

import static java.util.Objects.requireNonNull;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Predicate;

import com.github.behaviouractor.Receive.Matcher;


/**
 * Collects message handler registrations in declaration order and turns them into an immutable
 * {@link Receive}. The builder can be reused after {@link #build()} but already built
 * {@link Receive} instances are never affected by the subsequent registrations.
 */
@SuppressWarnings({ "rawtypes", "unchecked" })
public class ReceiveBuilder {

	private final String name;
	private final List<Matcher> matchers = new ArrayList<>();

	ReceiveBuilder(final String name) {
		this.name = requireNonNull(name, "Behaviour name must not be null");
	}

	/**
	 * Consume message by a given {@link Consumer} when message is the instance of the provided type.
	 *
	 * @param <M> the message type - inferred
	 * @param type the type (a {@link Class}) to match
	 * @param consumer the {@link Consumer} to use when message is instance of a given type
	 * @return This {@link ReceiveBuilder}
	 */
	public <M> ReceiveBuilder match(final Class<M> type, final Consumer<M> consumer) {
		return add(type, null, consumer);
	}

	/**
	 * Consume message by a given {@link Consumer} when message is the instance of the provided type
	 * and the guard {@link Predicate} accepts it. The guard must not have side effects, it may be
	 * evaluated for messages which end up being handled by a different registration.
	 *
	 * @param <M> the message type - inferred
	 * @param type the type (a {@link Class}) to match
	 * @param guard the {@link Predicate} narrowing the accepted messages
	 * @param consumer the {@link Consumer} to use when message is accepted
	 * @return This {@link ReceiveBuilder}
	 */
	public <M> ReceiveBuilder match(final Class<M> type, final Predicate<M> guard, final Consumer<M> consumer) {
		return add(type, requireNonNull(guard, "Guard must not be null"), consumer);
	}

	/**
	 * Consume message by a given {@link Consumer} when it is equal to the provided value.
	 *
	 * @param <M> the message type - inferred
	 * @param value the value to compare message with
	 * @param consumer the {@link Consumer} to invoke
	 * @return This {@link ReceiveBuilder}
	 */
	public <M> ReceiveBuilder matchEquals(final M value, final Consumer<M> consumer) {
		final Class<M> type = (Class<M>) value.getClass();
		return add(type, (Predicate<M>) value::equals, consumer);
	}

	/**
	 * Consume any message which has not been matched by the registrations declared before this one.
	 *
	 * @param consumer the {@link Consumer} to invoke.
	 * @return This {@link ReceiveBuilder}
	 */
	public ReceiveBuilder matchAny(final Consumer<Object> consumer) {
		return match(Object.class, consumer);
	}

	/**
	 * @return New immutable {@link Receive} containing all registrations declared so far
	 */
	public Receive build() {
		return new Receive(name, matchers.toArray(Matcher[]::new));
	}

	private <M> ReceiveBuilder add(final Class<M> type, final Predicate<M> guard, final Consumer<M> consumer) {

		requireNonNull(type, "Message type must not be null");
		requireNonNull(consumer, "Consumer must not be null");

		matchers.add(new Matcher(type, (Predicate) guard, (Consumer) consumer));

		return this;
	}
}
