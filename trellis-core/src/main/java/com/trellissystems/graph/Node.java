package com.trellissystems.graph;

import com.trellissystems.Element;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A unit of work or state in a workflow.
 * Nodes know nothing about their edges; relations live in the owning {@link Graph}.
 */
public class Node extends Element {

    private final Object content;
    private final Map<String, Object> metadata;

    public Node(Object content) {
        this(content, Map.of());
    }

    public Node(Object content, Map<String, Object> metadata) {
        this.content = content;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * Returns the arbitrary content of this node.
     *
     * @return the content, possibly null
     */
    public Object getContent() {
        return content;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{id=" + getId() + ", content=" + content + "}";
    }
}
