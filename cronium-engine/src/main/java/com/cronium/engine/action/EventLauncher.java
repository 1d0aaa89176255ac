package com.cronium.engine.action;

import java.util.concurrent.CompletableFuture;

/**
 * Starts an independent run of another event.
 */
@FunctionalInterface
public interface EventLauncher {

    CompletableFuture<?> launch(long eventId);
}
