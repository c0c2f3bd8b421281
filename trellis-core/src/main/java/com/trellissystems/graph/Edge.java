package com.trellissystems.graph;

import com.trellissystems.Element;
import com.trellissystems.IdType;

/**
 * Directed relation from a head node to a tail node, referenced by id only.
 *
 * <p>An edge may carry a {@link EdgeCondition}. A {@code bundle} edge is not a step of its own:
 * its tail is merged into the composite action built for the edge's head when the traversal
 * reaches that head.
 */
public final class Edge extends Element {

    private final String head;
    private final String tail;
    private final EdgeCondition condition;
    private final boolean bundle;
    private final String label;

    public Edge(Object head, Object tail) {
        this(head, tail, null, false, null);
    }

    /**
     * Creates an edge.
     *
     * @param head      the head node or its id
     * @param tail      the tail node or its id
     * @param condition an optional traversal condition
     * @param bundle    whether the tail is bundled into the head's action
     * @param label     an optional label
     */
    public Edge(Object head, Object tail, EdgeCondition condition, boolean bundle, String label) {
        this.head = IdType.of(head);
        this.tail = IdType.of(tail);
        this.condition = condition;
        this.bundle = bundle;
        this.label = label;
    }

    public String getHead() {
        return head;
    }

    public String getTail() {
        return tail;
    }

    /**
     * Returns the traversal condition.
     *
     * @return the condition, or null if the edge is unconditional
     */
    public EdgeCondition getCondition() {
        return condition;
    }

    public boolean hasCondition() {
        return condition != null;
    }

    public boolean isBundle() {
        return bundle;
    }

    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return "Edge{id=" + getId() + ", " + head + " -> " + tail
                + (bundle ? ", bundle" : "")
                + (label == null ? "" : ", label=" + label) + "}";
    }
}
