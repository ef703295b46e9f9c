package com.github.behaviouractor.dsl;

import com.github.behaviouractor.ActorContext;


/**
 * Gives the mix-in interfaces access to the {@link ActorContext}. Implemented by every actor.
 */
public interface InternalContext {

	ActorContext context();
}
