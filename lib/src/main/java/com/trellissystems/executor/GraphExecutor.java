package com.trellissystems.executor;

import com.trellissystems.ItemNotFoundException;
import com.trellissystems.StructureException;
import com.trellissystems.action.ActionBundles;
import com.trellissystems.config.ExecutorConfig;
import com.trellissystems.graph.Direction;
import com.trellissystems.graph.Edge;
import com.trellissystems.graph.EdgeCondition;
import com.trellissystems.graph.Graph;
import com.trellissystems.graph.Node;
import com.trellissystems.mailbox.Mail;
import com.trellissystems.mailbox.MailPackage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Traverses a graph on request, driven entirely by mail.
 *
 * <p>A {@code START} mail answers with the head nodes; a {@code NODE} or {@code NODE_ID} mail names
 * the position a branch reached and answers with the next steps. Next steps follow the outgoing
 * edges of the position that are not bundle edges and whose condition holds; a target that has
 * bundle edges of its own is replaced by the composite built from them. No next step answers
 * {@code END} and ends the traversal for that request source, one step answers {@code NODE},
 * several answer {@code NODE_LIST}. An {@code END} mail stops the executor.
 *
 * <p>Executable conditions are sent to the branch that asked, as a {@code CONDITION} mail; the
 * traversal resumes when the answer arrives or fails with a {@link ConditionTimeoutException}.
 *
 * <p>The executor owns its graph for the duration of a run.
 */
public class GraphExecutor extends AbstractExecutor {

    private static final Logger logger = LoggerFactory.getLogger(GraphExecutor.class);

    private final Graph graph;
    private final Map<String, TraversalState> traversals = new ConcurrentHashMap<>();
    private final Map<ConditionKey, CompletableFuture<Boolean>> pendingConditions = new ConcurrentHashMap<>();

    /**
     * Lifecycle of the traversal of one request source.
     */
    public enum TraversalState {
        RUNNING,
        TERMINATED
    }

    private record ConditionKey(String requestSource, String edgeId) {
    }

    public GraphExecutor(Graph graph) {
        this(graph, new ExecutorConfig());
    }

    public GraphExecutor(Graph graph, ExecutorConfig config) {
        super(config);
        this.graph = graph;
    }

    public Graph getGraph() {
        return graph;
    }

    /**
     * Returns the state of the traversal of a request source.
     *
     * @param requestSource the branch id
     * @return the state, or null if that source never started or reached an end
     */
    public TraversalState traversalState(String requestSource) {
        return traversals.get(requestSource);
    }

    public int pendingConditionCount() {
        return pendingConditions.size();
    }

    @Override
    protected void beforeExecute() {
        if (!graph.isAcyclic()) {
            throw new StructureException("Structure " + getId() + " is not acyclic");
        }
    }

    @Override
    protected void step() {
        for (Mail mail : getMailbox().drainInbound()) {
            if (isStopped()) {
                logger.debug("Structure {} stopped, ignoring {}", getId(), mail);
                continue;
            }
            handle(mail);
        }
    }

    private void handle(Mail mail) {
        logger.debug("Structure {} handling {}", getId(), mail);
        CompletableFuture<List<Node>> next;
        try {
            next = switch (mail.getCategory()) {
                case START -> start(mail);
                case END -> {
                    logger.info("Structure {} received end from {}", getId(), mail.getSender());
                    stop();
                    yield null;
                }
                case NODE -> advance(mail, ((MailPackage.NodeDelivery) mail.getPackage()).node().getId());
                case NODE_ID -> advance(mail, ((MailPackage.NodeIdDelivery) mail.getPackage()).nodeId());
                case NODE_LIST -> throw new IllegalArgumentException("Invalid mail type for structure: NODE_LIST");
                case CONDITION -> {
                    resolveCondition(mail);
                    yield null;
                }
            };
        } catch (RuntimeException e) {
            throw traversalError(mail, e);
        }
        if (next != null) {
            whenReady(next, mail, nodes -> reply(mail, nodes));
        }
    }

    private CompletableFuture<List<Node>> start(Mail mail) {
        traversals.put(mail.getPackage().requestSource(), TraversalState.RUNNING);
        return CompletableFuture.completedFuture(graph.getHeads());
    }

    private CompletableFuture<List<Node>> advance(Mail mail, String nodeId) {
        String requestSource = mail.getPackage().requestSource();
        if (traversals.get(requestSource) == TraversalState.TERMINATED) {
            throw new IllegalStateException("Traversal for " + requestSource + " already ended");
        }
        if (!graph.containsNode(nodeId)) {
            throw new ItemNotFoundException(nodeId, "Node " + nodeId + " does not exist in structure " + getId());
        }
        return nextNodes(graph.getNode(nodeId), mail.getSender(), requestSource);
    }

    /**
     * Computes the next steps from a node. Conditions are checked one edge at a time, in edge
     * insertion order.
     *
     * @param current       the position
     * @param executableId  the actor that evaluates executable conditions
     * @param requestSource the branch the traversal belongs to
     * @return the next steps, completed once every condition was answered
     */
    CompletableFuture<List<Node>> nextNodes(Node current, String executableId, String requestSource) {
        CompletableFuture<List<Node>> chain = CompletableFuture.completedFuture(new ArrayList<>());
        for (Edge edge : graph.findNodeEdges(current, Direction.OUT)) {
            if (edge.isBundle()) {
                continue;
            }
            chain = chain.thenCompose(accepted -> checkCondition(edge, executableId, requestSource)
                    .thenApply(pass -> {
                        if (pass) {
                            accepted.add(target(edge));
                        }
                        return accepted;
                    }));
        }
        return chain;
    }

    private Node target(Edge edge) {
        Node node = graph.getNode(edge.getTail());
        List<Node> bundled = new ArrayList<>();
        for (Edge further : graph.findNodeEdges(node, Direction.OUT)) {
            if (further.isBundle()) {
                bundled.add(graph.getNode(further.getTail()));
            }
        }
        return bundled.isEmpty() ? node : ActionBundles.merge(node, bundled);
    }

    private CompletableFuture<Boolean> checkCondition(Edge edge, String executableId, String requestSource) {
        EdgeCondition condition = edge.getCondition();
        if (condition == null) {
            return CompletableFuture.completedFuture(true);
        }
        switch (condition.sourceType()) {
            case STRUCTURE:
                return CompletableFuture.completedFuture(condition.check(graph));
            case EXECUTABLE:
                return requestCondition(edge, executableId, requestSource);
            default:
                throw new IllegalStateException("Unknown condition source: " + condition.sourceType());
        }
    }

    private CompletableFuture<Boolean> requestCondition(Edge edge, String executableId, String requestSource) {
        ConditionKey key = new ConditionKey(requestSource, edge.getId());
        CompletableFuture<Boolean> answer = new CompletableFuture<>();
        CompletableFuture<Boolean> existing = pendingConditions.putIfAbsent(key, answer);
        if (existing != null) {
            return existing;
        }
        send(executableId, new MailPackage.ConditionRequest(requestSource, edge));
        logger.debug("Structure {} asked {} for condition of edge {}", getId(), executableId, edge.getId());
        long timeoutMillis = getConfig().getConditionTimeout().toMillis();
        return answer.orTimeout(timeoutMillis, TimeUnit.MILLISECONDS)
                .handle((result, error) -> {
                    pendingConditions.remove(key, answer);
                    if (error == null) {
                        return result;
                    }
                    Throwable cause = unwrap(error);
                    if (cause instanceof TimeoutException) {
                        throw new ConditionTimeoutException(getId(), edge.getId(), requestSource,
                                getConfig().getConditionTimeout());
                    }
                    throw new CompletionException(cause);
                });
    }

    private void resolveCondition(Mail mail) {
        if (!(mail.getPackage() instanceof MailPackage.ConditionReply)) {
            throw new IllegalArgumentException("Structure only accepts condition replies, got " + mail.getPackage());
        }
        MailPackage.ConditionReply reply = (MailPackage.ConditionReply) mail.getPackage();
        CompletableFuture<Boolean> answer = pendingConditions.get(new ConditionKey(reply.requestSource(), reply.edgeId()));
        if (answer == null) {
            logger.warn("Structure {} got an answer for edge {} from {} that nobody waits for",
                    getId(), reply.edgeId(), reply.requestSource());
            return;
        }
        answer.complete(reply.result());
    }

    private void reply(Mail mail, List<Node> nodes) {
        String requestSource = mail.getPackage().requestSource();
        if (nodes.isEmpty()) {
            traversals.put(requestSource, TraversalState.TERMINATED);
            send(mail.getSender(), new MailPackage.End(requestSource));
            logger.info("Structure {} reached the end of the traversal for {}", getId(), requestSource);
        } else if (nodes.size() == 1) {
            send(mail.getSender(), new MailPackage.NodeDelivery(requestSource, nodes.get(0)));
        } else {
            send(mail.getSender(), new MailPackage.NodeListDelivery(requestSource, nodes));
        }
    }
}
