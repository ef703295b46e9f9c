package com.github.behaviouractor;

import com.github.behaviouractor.Receive.Matcher;


/**
 * Resolves a message against a {@link Receive} and invokes the matched action. Registrations are
 * scanned in declaration order and the first one whose type matches and whose guard accepts the
 * message wins. Guards are evaluated only for registrations of a matching type. Whatever the guard
 * or the action throws is propagated to the caller unchanged.
 */
public final class Dispatcher {

	public enum Outcome {

		/**
		 * Message was passed to the action of the matched registration.
		 */
		HANDLED,

		/**
		 * No registration accepted the message. What to do with it is decided by the caller.
		 */
		UNHANDLED,
	}

	private Dispatcher() {
		// static utility
	}

	/**
	 * @param receive the behaviour to dispatch message against
	 * @param message the message to dispatch
	 * @return {@link Outcome#HANDLED} if action has been invoked, {@link Outcome#UNHANDLED}
	 *         otherwise
	 */
	public static Outcome dispatch(final Receive receive, final Object message) {

		final Matcher matcher = find(receive.matchers(), message);

		if (matcher == null) {
			return Outcome.UNHANDLED;
		}

		matcher.action.accept(message);

		return Outcome.HANDLED;
	}

	private static Matcher find(final Matcher[] matchers, final Object message) {
		for (final Matcher matcher : matchers) {
			if (matcher.accepts(message)) {
				return matcher;
			}
		}
		return null;
	}
}
