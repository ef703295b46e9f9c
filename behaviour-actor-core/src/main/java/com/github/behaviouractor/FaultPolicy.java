package com.github.behaviouractor;

/**
 * Decides how to recover from the failure thrown from the actor's message handler or from one of
 * its lifecycle hooks. The failed message is never retried.
 */
@FunctionalInterface
public interface FaultPolicy {

	FaultDirective decide(final Throwable cause);

	static FaultPolicy resume() {
		return cause -> FaultDirective.RESUME;
	}

	static FaultPolicy restart() {
		return cause -> FaultDirective.RESTART;
	}

	static FaultPolicy stop() {
		return cause -> FaultDirective.STOP;
	}
}
