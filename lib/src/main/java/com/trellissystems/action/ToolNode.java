package com.trellissystems.action;

import com.trellissystems.graph.Node;

import java.util.Map;
import java.util.Objects;

/**
 * Graph node attaching a {@link Tool} to the step it is bundled with.
 */
public class ToolNode extends Node {

    private final Tool tool;

    public ToolNode(Tool tool) {
        super(Objects.requireNonNull(tool, "tool cannot be null").name(), Map.of("kind", "tool"));
        this.tool = tool;
    }

    public Tool getTool() {
        return tool;
    }
}
