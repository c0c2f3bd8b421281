package com.trellissystems.action;

import com.trellissystems.graph.Node;

import java.util.Map;
import java.util.Objects;

/**
 * Graph node choosing which action a branch performs for the step it is bundled with.
 */
public class ActionSelection extends Node {

    private final String action;
    private final Map<String, Object> actionKwargs;

    public ActionSelection(String action) {
        this(action, Map.of());
    }

    public ActionSelection(String action, Map<String, Object> actionKwargs) {
        super(Objects.requireNonNull(action, "action cannot be null"), Map.of("kind", "action"));
        this.action = action;
        this.actionKwargs = Map.copyOf(actionKwargs);
    }

    public String getAction() {
        return action;
    }

    public Map<String, Object> getActionKwargs() {
        return actionKwargs;
    }
}
