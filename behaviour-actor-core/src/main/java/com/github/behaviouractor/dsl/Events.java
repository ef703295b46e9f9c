package com.github.behaviouractor.dsl;

import com.github.behaviouractor.EventBus;


public interface Events extends InternalContext {

	/**
	 * Subscribe to the event bus. Subscriber receives events of a given type and all its subtypes.
	 *
	 * @param type the type of event to be subscribed
	 */
	default void subscribeEvent(final Class<?> type) {

		final var self = context().self();
		final var system = context().system();
		final var bus = system.refForEventBus();

		bus.tell(new EventBus.Subscribe(type, self), self);
	}

	/**
	 * Unsubscribe from the event bus.
	 *
	 * @param type the event type to unsubscribe
	 */
	default void unsubscribeEvent(final Class<?> type) {

		final var self = context().self();
		final var system = context().system();
		final var bus = system.refForEventBus();

		bus.tell(new EventBus.Unsubscribe(type, self), self);
	}

	/**
	 * Emit event into event bus.
	 *
	 * @param event the event to be emitted
	 */
	default void emitEvent(final Object event) {
		context()
			.system()
			.emitEvent(event, context().self());
	}
}
