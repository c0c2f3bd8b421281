package com.trellissystems.executor;

import com.trellissystems.graph.Node;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Performs the work a node stands for on behalf of a branch.
 */
@FunctionalInterface
public interface NodeProcessor {

    /**
     * Performs a node.
     *
     * @param node    the delivered node; an {@link com.trellissystems.action.ActionNode} is passed
     *                after its tools ran, with their results in the context
     * @param context the branch context, readable and writable by the processor
     * @return the result, completed asynchronously
     */
    CompletableFuture<Object> perform(Node node, Map<String, Object> context);
}
