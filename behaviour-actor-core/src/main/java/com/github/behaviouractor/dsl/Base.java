package com.github.behaviouractor.dsl;

import com.github.behaviouractor.ActorRef;


/**
 * Messaging shortcuts for actors. Everything sent from here carries {@link #self()} as a sender,
 * except {@link #forward(Object, ActorRef)} which keeps the sender of the message being processed.
 */
public interface Base extends InternalContext {

	default ActorRef self() {
		return context().self();
	}

	/**
	 * @return Sender of the message being processed, or no-sender reference outside of a handler
	 */
	default ActorRef sender() {
		return context().sender();
	}

	default void tell(final Object message, final ActorRef target) {
		target.tell(message, self());
	}

	default void reply(final Object message) {
		tell(message, sender());
	}

	default void forward(final Object message, final ActorRef target) {
		target.tell(message, sender());
	}

	/**
	 * Stop this actor once the running handler returns. Behaviour switches requested by the handler
	 * are not applied.
	 */
	default void stop() {
		context().stop();
	}
}
