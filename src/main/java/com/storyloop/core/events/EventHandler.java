package com.storyloop.core.events;

import java.util.concurrent.CompletionStage;

/**
 * Handler invoked for matching events. Synchronous handlers return an already-completed stage.
 */
@FunctionalInterface
public interface EventHandler {

    CompletionStage<?> handle(LoopEvent event) throws Exception;
}
