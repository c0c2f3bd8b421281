package com.trellissystems.mailbox;

import com.trellissystems.IdType;
import com.trellissystems.graph.Edge;
import com.trellissystems.graph.Node;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Payload of a {@link Mail}.
 *
 * <p>Every package names the request source it belongs to, the id of the branch on whose
 * behalf a traversal runs, and maps to exactly one {@link MailCategory}.
 */
public sealed interface MailPackage {

    String requestSource();

    MailCategory category();

    /**
     * Asks a structure to begin a traversal.
     */
    record Start(String requestSource, Map<String, Object> context) implements MailPackage {
        public Start {
            IdType.of(requestSource);
            context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
        }

        public Start(String requestSource) {
            this(requestSource, Map.of());
        }

        @Override
        public MailCategory category() {
            return MailCategory.START;
        }
    }

    /**
     * Signals the end of a traversal, in either direction.
     */
    record End(String requestSource) implements MailPackage {
        public End {
            IdType.of(requestSource);
        }

        @Override
        public MailCategory category() {
            return MailCategory.END;
        }
    }

    /**
     * Carries a single node: the next step, or the step just completed.
     */
    record NodeDelivery(String requestSource, Node node) implements MailPackage {
        public NodeDelivery {
            IdType.of(requestSource);
            Objects.requireNonNull(node, "node cannot be null");
        }

        @Override
        public MailCategory category() {
            return MailCategory.NODE;
        }
    }

    /**
     * Carries several next steps, to be fanned out into separate branches.
     */
    record NodeListDelivery(String requestSource, List<Node> nodes) implements MailPackage {
        public NodeListDelivery {
            IdType.of(requestSource);
            nodes = List.copyOf(nodes);
        }

        @Override
        public MailCategory category() {
            return MailCategory.NODE_LIST;
        }
    }

    /**
     * Names the current position of a traversal by node id.
     */
    record NodeIdDelivery(String requestSource, String nodeId) implements MailPackage {
        public NodeIdDelivery {
            IdType.of(requestSource);
            IdType.of(nodeId);
        }

        @Override
        public MailCategory category() {
            return MailCategory.NODE_ID;
        }
    }

    /**
     * Asks the request source to evaluate the executable condition of an edge.
     */
    record ConditionRequest(String requestSource, Edge edge) implements MailPackage {
        public ConditionRequest {
            IdType.of(requestSource);
            Objects.requireNonNull(edge, "edge cannot be null");
        }

        @Override
        public MailCategory category() {
            return MailCategory.CONDITION;
        }
    }

    /**
     * Answer to a {@link ConditionRequest}.
     */
    record ConditionReply(String requestSource, String edgeId, boolean result) implements MailPackage {
        public ConditionReply {
            IdType.of(requestSource);
            IdType.of(edgeId);
        }

        @Override
        public MailCategory category() {
            return MailCategory.CONDITION;
        }
    }
}
