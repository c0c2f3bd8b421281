package com.trellissystems.graph;

/**
 * Edge direction relative to a node.
 */
public enum Direction {
    IN,
    OUT,
    BOTH
}
