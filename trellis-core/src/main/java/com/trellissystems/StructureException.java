package com.trellissystems;

/**
 * Thrown on structural violations of a graph: an edge whose endpoints are not members,
 * a duplicate node, an invalid bundle, or executing a graph that contains a cycle.
 */
public class StructureException extends TrellisException {

    public StructureException(String message) {
        super(message);
    }

    public StructureException(String message, Throwable cause) {
        super(message, cause);
    }
}
