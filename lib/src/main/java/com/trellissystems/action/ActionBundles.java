package com.trellissystems.action;

import com.trellissystems.StructureException;
import com.trellissystems.graph.Node;

import java.util.List;

/**
 * Merges bundled nodes into the step they are attached to.
 */
public final class ActionBundles {

    private ActionBundles() {
    }

    /**
     * Builds the composite action for an instruction and the tails of its bundle edges.
     * An {@link ActionSelection} sets the action; every {@link ToolNode} adds its tool.
     *
     * @param instruction the step reached by the traversal
     * @param bundled     the bundled nodes, in edge order
     * @return the composite node
     * @throws StructureException if a bundled node is neither a tool nor an action selection
     */
    public static ActionNode merge(Node instruction, List<? extends Node> bundled) {
        ActionNode actionNode = new ActionNode(instruction);
        for (Node node : bundled) {
            if (node instanceof ActionSelection) {
                actionNode.select((ActionSelection) node);
            } else if (node instanceof ToolNode) {
                actionNode.addTool(((ToolNode) node).getTool());
            } else {
                throw new StructureException("Invalid bundled node " + node.getId()
                        + ": only tools and action selections can be bundled");
            }
        }
        return actionNode;
    }
}
