package com.trellissystems.action;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * An external capability a branch can invoke while performing an action.
 */
public interface Tool {

    String name();

    /**
     * Invokes the tool.
     *
     * @param arguments named arguments
     * @return the result, completed asynchronously
     */
    CompletableFuture<Object> perform(Map<String, Object> arguments);
}
