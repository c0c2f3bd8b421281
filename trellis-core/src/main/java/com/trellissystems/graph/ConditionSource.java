package com.trellissystems.graph;

/**
 * Where an edge condition is evaluated.
 */
public enum ConditionSource {
    /** Evaluated synchronously against the graph that owns the edge. */
    STRUCTURE,
    /** Evaluated by a remote actor, reached through a condition mail round trip. */
    EXECUTABLE
}
