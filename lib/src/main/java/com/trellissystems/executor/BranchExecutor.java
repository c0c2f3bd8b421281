package com.trellissystems.executor;

import com.trellissystems.action.ActionNode;
import com.trellissystems.action.Tool;
import com.trellissystems.config.ExecutorConfig;
import com.trellissystems.graph.Edge;
import com.trellissystems.graph.Node;
import com.trellissystems.mailbox.Mail;
import com.trellissystems.mailbox.MailPackage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Worker side of a traversal: performs the nodes a structure delivers and reports back.
 *
 * <p>A branch asks a structure to start with {@link #requestStart(String)}. Each delivered node
 * is performed through the {@link NodeProcessor}; for an {@link ActionNode} the bundled tools run
 * first, in order, each receiving the action arguments and the previous tool's output under
 * {@value #INPUT_KEY}. Once a node is done the branch answers with its id ({@code NODE_ID}); for
 * a composite, with the id of its instruction. Condition requests are answered by evaluating the
 * condition against this branch. An {@code END} mail stops the branch, which acknowledges it.
 */
public class BranchExecutor extends AbstractExecutor {

    private static final Logger logger = LoggerFactory.getLogger(BranchExecutor.class);

    /** Argument under which a tool receives the output of the tool before it. */
    public static final String INPUT_KEY = "input";

    private final NodeProcessor processor;
    private final Map<String, Object> context = Collections.synchronizedMap(new LinkedHashMap<>());
    private final List<Map<String, Object>> contextLog = Collections.synchronizedList(new ArrayList<>());
    private final List<ExecutionRecord> executionLog = Collections.synchronizedList(new ArrayList<>());
    private final Map<String, Tool> registeredTools = new LinkedHashMap<>();

    /**
     * One performed node and its result.
     */
    public record ExecutionRecord(String nodeId, String action, Object result) {
    }

    public BranchExecutor(NodeProcessor processor) {
        this(processor, new ExecutorConfig());
    }

    public BranchExecutor(NodeProcessor processor, ExecutorConfig config) {
        super(config);
        this.processor = Objects.requireNonNull(processor, "processor cannot be null");
    }

    /**
     * Creates a branch that continues independently from this one's context and history.
     *
     * @return the clone, with a new id and an empty mailbox
     */
    public BranchExecutor cloneBranch() {
        BranchExecutor clone = new BranchExecutor(processor, getConfig());
        synchronized (context) {
            clone.context.putAll(context);
        }
        synchronized (contextLog) {
            clone.contextLog.addAll(contextLog);
        }
        synchronized (executionLog) {
            clone.executionLog.addAll(executionLog);
        }
        synchronized (registeredTools) {
            clone.registeredTools.putAll(registeredTools);
        }
        return clone;
    }

    /**
     * Asks a structure to start a traversal on behalf of this branch.
     *
     * @param structureId the graph executor id
     * @return the posted mail
     */
    public Mail requestStart(String structureId) {
        return send(structureId, new MailPackage.Start(getId(), snapshotContext()));
    }

    public Map<String, Object> getContext() {
        return context;
    }

    /**
     * Returns the context as it was before each performed node.
     *
     * @return snapshots, oldest first
     */
    public List<Map<String, Object>> getContextLog() {
        synchronized (contextLog) {
            return List.copyOf(contextLog);
        }
    }

    public List<ExecutionRecord> getExecutionLog() {
        synchronized (executionLog) {
            return List.copyOf(executionLog);
        }
    }

    public List<Object> getResults() {
        List<Object> results = new ArrayList<>();
        for (ExecutionRecord record : getExecutionLog()) {
            results.add(record.result());
        }
        return results;
    }

    public Map<String, Tool> getRegisteredTools() {
        synchronized (registeredTools) {
            return Map.copyOf(registeredTools);
        }
    }

    @Override
    protected void step() {
        for (Mail mail : getMailbox().drainInbound()) {
            if (isStopped()) {
                logger.debug("Branch {} stopped, ignoring {}", getId(), mail);
                continue;
            }
            handle(mail);
        }
    }

    private void handle(Mail mail) {
        logger.debug("Branch {} handling {}", getId(), mail);
        try {
            switch (mail.getCategory()) {
                case NODE -> perform(mail, ((MailPackage.NodeDelivery) mail.getPackage()).node());
                case CONDITION -> answerCondition(mail);
                case END -> {
                    stop();
                    send(mail.getSender(), new MailPackage.End(getId()));
                    logger.info("Branch {} finished after {} steps", getId(), executionLog.size());
                }
                case START, NODE_ID, NODE_LIST -> throw new IllegalArgumentException(
                        "Invalid mail type for branch: " + mail.getCategory());
            }
        } catch (RuntimeException e) {
            throw traversalError(mail, e);
        }
    }

    private void perform(Mail mail, Node node) {
        contextLog.add(snapshotContext());
        CompletableFuture<Object> result;
        String action;
        String reportedId;
        if (node instanceof ActionNode) {
            ActionNode actionNode = (ActionNode) node;
            action = actionNode.getAction();
            reportedId = actionNode.getInstruction().getId();
            result = runTools(actionNode).thenCompose(toolOutput -> {
                if (!actionNode.getTools().isEmpty()) {
                    context.put(INPUT_KEY, toolOutput);
                }
                return processor.perform(actionNode, context);
            });
        } else {
            action = null;
            reportedId = node.getId();
            result = processor.perform(node, context);
        }
        whenReady(result, mail, value -> {
            executionLog.add(new ExecutionRecord(reportedId, action, value));
            send(mail.getSender(), new MailPackage.NodeIdDelivery(getId(), reportedId));
        });
    }

    private CompletableFuture<Object> runTools(ActionNode actionNode) {
        CompletableFuture<Object> chain = CompletableFuture.completedFuture(null);
        for (Tool tool : actionNode.getTools()) {
            synchronized (registeredTools) {
                registeredTools.putIfAbsent(tool.name(), tool);
            }
            chain = chain.thenCompose(previous -> {
                Map<String, Object> arguments = new LinkedHashMap<>(actionNode.getActionKwargs());
                if (previous != null) {
                    arguments.put(INPUT_KEY, previous);
                }
                logger.debug("Branch {} invoking tool {}", getId(), tool.name());
                return tool.perform(arguments);
            });
        }
        return chain;
    }

    private void answerCondition(Mail mail) {
        if (!(mail.getPackage() instanceof MailPackage.ConditionRequest)) {
            throw new IllegalArgumentException("Branch only accepts condition requests, got " + mail.getPackage());
        }
        Edge edge = ((MailPackage.ConditionRequest) mail.getPackage()).edge();
        boolean result = edge.getCondition().check(this);
        send(mail.getSender(), new MailPackage.ConditionReply(getId(), edge.getId(), result));
    }

    private Map<String, Object> snapshotContext() {
        synchronized (context) {
            return new LinkedHashMap<>(context);
        }
    }
}
