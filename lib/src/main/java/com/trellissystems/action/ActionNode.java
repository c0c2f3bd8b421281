package com.trellissystems.action;

import com.trellissystems.graph.Node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Composite step built during traversal: an instruction node plus the tools and action
 * selection bundled to it. The composite is not a member of the graph; the branch reports
 * progress with the id of {@link #getInstruction()}.
 */
public class ActionNode extends Node {

    public static final String DEFAULT_ACTION = "perform";

    private final Node instruction;
    private final List<Tool> tools = new ArrayList<>();
    private String action = DEFAULT_ACTION;
    private Map<String, Object> actionKwargs = Map.of();

    public ActionNode(Node instruction) {
        super(Objects.requireNonNull(instruction, "instruction cannot be null").getContent(), instruction.getMetadata());
        this.instruction = instruction;
    }

    public Node getInstruction() {
        return instruction;
    }

    public List<Tool> getTools() {
        return Collections.unmodifiableList(tools);
    }

    public String getAction() {
        return action;
    }

    public Map<String, Object> getActionKwargs() {
        return actionKwargs;
    }

    void addTool(Tool tool) {
        tools.add(tool);
    }

    void select(ActionSelection selection) {
        this.action = selection.getAction();
        this.actionKwargs = selection.getActionKwargs();
    }

    @Override
    public String toString() {
        return "ActionNode{id=" + getId() + ", instruction=" + instruction.getId()
                + ", action=" + action + ", tools=" + tools.size() + "}";
    }
}
