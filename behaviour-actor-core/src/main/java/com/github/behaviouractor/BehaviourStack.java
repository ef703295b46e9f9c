package com.github.behaviouractor;

import static java.util.Objects.requireNonNull;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;


/**
 * Per-actor stack of behaviours. The top element is the {@link Receive} consulted for the next
 * message. Once initialized with {@link #reset(Receive)} the stack is never empty until it is
 * cleared on actor stop - the initial behaviour cannot be popped.
 * <p>
 *
 * This class is not thread-safe. It is owned by a single {@link ActorCell} and touched only by
 * the {@link ActorThread} the cell is docked on.
 */
public final class BehaviourStack {

	private final Deque<Receive> stack = new ArrayDeque<>(2);

	/**
	 * Replace current behaviour with a new one. The previous behaviour is discarded.
	 *
	 * @param receive the new behaviour
	 */
	public void become(final Receive receive) {
		become(receive, true);
	}

	/**
	 * Switch to a new behaviour. When discardPrevious is true the current top is replaced (depth
	 * does not change), otherwise the new behaviour is pushed on top of the current one so it can
	 * be restored with {@link #unbecome()}.
	 *
	 * @param receive the new behaviour
	 * @param discardPrevious should the current behaviour be discarded
	 */
	public void become(final Receive receive, final boolean discardPrevious) {

		requireNonNull(receive, "Behaviour must not be null");

		if (stack.isEmpty()) {
			throw notInitializedError();
		}
		if (discardPrevious) {
			stack.pop();
		}

		stack.push(receive);
	}

	/**
	 * Revert to the previous behaviour. Does nothing when only the initial behaviour is left.
	 *
	 * @return True if behaviour has been popped, false otherwise
	 */
	public boolean unbecome() {
		if (stack.size() > 1) {
			stack.pop();
			return true;
		} else {
			return false;
		}
	}

	/**
	 * @return The active behaviour
	 * @throws IllegalStateException when stack has never been initialized
	 */
	public Receive current() {

		final Receive top = stack.peek();

		if (top == null) {
			throw notInitializedError();
		}

		return top;
	}

	/**
	 * Drop all behaviours and leave only the provided one.
	 *
	 * @param initial the behaviour to start over with
	 */
	public void reset(final Receive initial) {
		requireNonNull(initial, "Initial behaviour must not be null");
		stack.clear();
		stack.push(initial);
	}

	void clear() {
		stack.clear();
	}

	public int depth() {
		return stack.size();
	}

	public boolean isInitialized() {
		return !stack.isEmpty();
	}

	/**
	 * @return Names of the stacked behaviours, the active one first
	 */
	public List<String> names() {
		final List<String> names = new ArrayList<>(stack.size());
		for (final Receive receive : stack) {
			names.add(receive.name());
		}
		return names;
	}

	private static IllegalStateException notInitializedError() {
		return new IllegalStateException("Behaviour stack has not been initialized");
	}
}
