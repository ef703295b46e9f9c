package com.github.behaviouractor.dsl;

import com.github.behaviouractor.Receive;


/**
 * An utility interface exposing methods to switch actor behaviours.
 */
public interface Behaviours extends InternalContext {

	/**
	 * @param receive the behaviour to replace the active one with
	 */
	default void become(final Receive receive) {
		context().become(receive);
	}

	/**
	 * @param receive the behaviour to stack on top of the active one
	 */
	default void becomeStacked(final Receive receive) {
		context().become(receive, false);
	}

	/**
	 * Go back to the previously stacked behaviour, if any.
	 */
	default void unbecome() {
		context().unbecome();
	}
}
