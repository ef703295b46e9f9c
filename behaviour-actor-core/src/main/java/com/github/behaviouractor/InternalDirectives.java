package com.github.behaviouractor;

import static com.github.behaviouractor.Directive.ExecutionMode.RUN_IN_ORDER;

import com.github.behaviouractor.message.ActorIdentity;


interface InternalDirectives {

	final static Directive START = new Start();
	final static Directive STOP = new Stop();

	/**
	 * Mark cell as initialized and start processing messages.
	 */
	class Start implements Directive {

		@Override
		public void execute(final ActorCell<? extends Actor> cell) {
			cell.start();
		}
	}

	/**
	 * Stop the cell immediately.
	 */
	class Stop implements Directive {

		@Override
		public void execute(final ActorCell<? extends Actor> cell) {
			cell.stop();
		}
	}

	/**
	 * Stop the cell after messages received before have been processed.
	 */
	class PoisonPill extends Stop {

		@Override
		public ExecutionMode mode() {
			return RUN_IN_ORDER;
		}
	}

	class Restart implements Directive {

		@Override
		public void execute(final ActorCell<? extends Actor> cell) {
			cell.restart(null);
		}

		@Override
		public ExecutionMode mode() {
			return RUN_IN_ORDER;
		}
	}

	class Identify implements Directive {

		@Override
		public void execute(final ActorCell<? extends Actor> cell) {
			cell.reply(new ActorIdentity(cell.self()));
		}

		@Override
		public ExecutionMode mode() {
			return RUN_IN_ORDER;
		}

		@Override
		public boolean expectsReply() {
			return true;
		}
	}

	class Inspect implements Directive {

		@Override
		public void execute(final ActorCell<? extends Actor> cell) {
			cell.reply(cell.snapshot());
		}

		@Override
		public ExecutionMode mode() {
			return RUN_IN_ORDER;
		}

		@Override
		public boolean expectsReply() {
			return true;
		}
	}
}
