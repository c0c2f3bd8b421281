package com.trellissystems.graph;

import com.trellissystems.Element;
import com.trellissystems.IdType;
import com.trellissystems.ItemNotFoundException;
import com.trellissystems.StructureException;
import com.trellissystems.collections.Pile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Directed graph of {@link Node}s connected by {@link Edge}s.
 *
 * <p>Nodes and edges are kept in {@link Pile}s; an adjacency index maps every node id to its
 * incoming and outgoing edges (edge id to the id of the node on the other end), in insertion
 * order. Every edge endpoint is always a member node: removing a node removes its edges.
 */
public class Graph extends Element {

    private static final Logger logger = LoggerFactory.getLogger(Graph.class);

    private final Pile<Node> nodes = new Pile<>();
    private final Pile<Edge> edges = new Pile<>(Set.of(Edge.class));
    private final Map<String, Relations> relations = new HashMap<>();

    /**
     * Adds a node.
     *
     * @param node the node to add
     * @throws StructureException if the node is already present
     */
    public synchronized void addNode(Node node) {
        if (nodes.contains(node)) {
            throw new StructureException("Node already in graph: " + node.getId());
        }
        nodes.include(node);
        relations.put(node.getId(), new Relations());
    }

    public synchronized void addNodes(Iterable<? extends Node> batch) {
        for (Node node : batch) {
            addNode(node);
        }
    }

    /**
     * Adds an edge between two member nodes.
     *
     * @param edge the edge to add
     * @throws StructureException if the edge is already present or an endpoint is not a member
     */
    public synchronized void addEdge(Edge edge) {
        if (edges.contains(edge)) {
            throw new StructureException("Edge already in graph: " + edge.getId());
        }
        if (!relations.containsKey(edge.getHead()) || !relations.containsKey(edge.getTail())) {
            throw new StructureException("Failed to add edge " + edge.getId()
                    + ": head and tail must both be in the graph");
        }
        edges.include(edge);
        relations.get(edge.getHead()).out.put(edge.getId(), edge.getTail());
        relations.get(edge.getTail()).in.put(edge.getId(), edge.getHead());
        logger.debug("Graph {} linked {} -> {} via edge {}", getId(), edge.getHead(), edge.getTail(), edge.getId());
    }

    public Edge addEdge(Object head, Object tail) {
        return addEdge(head, tail, null, false, null);
    }

    /**
     * Creates and adds an edge.
     *
     * @param head      the head node or its id
     * @param tail      the tail node or its id
     * @param condition optional traversal condition
     * @param bundle    whether the tail is bundled into the head's action
     * @param label     optional label
     * @return the created edge
     */
    public Edge addEdge(Object head, Object tail, EdgeCondition condition, boolean bundle, String label) {
        Edge edge = new Edge(head, tail, condition, bundle, label);
        addEdge(edge);
        return edge;
    }

    /**
     * Removes a node together with every edge touching it.
     *
     * @param node the node or its id
     * @return the removed node
     * @throws ItemNotFoundException if the node is not a member
     */
    public synchronized Node removeNode(Object node) {
        String id = IdType.of(node);
        Relations rel = relations.get(id);
        if (rel == null) {
            throw new ItemNotFoundException(id, "Node not found in graph: " + id);
        }
        Set<String> touching = new LinkedHashSet<>(rel.in.keySet());
        touching.addAll(rel.out.keySet());
        for (String edgeId : touching) {
            unlink(edges.pop(edgeId));
        }
        relations.remove(id);
        return nodes.pop(id);
    }

    /**
     * Removes an edge.
     *
     * @param edge the edge or its id
     * @return the removed edge
     * @throws ItemNotFoundException if the edge is not a member
     */
    public synchronized Edge removeEdge(Object edge) {
        String id = IdType.of(edge);
        Edge removed = edges.pop(id);
        unlink(removed);
        return removed;
    }

    public synchronized Node getNode(String id) {
        return nodes.get(id);
    }

    public synchronized Edge getEdge(String id) {
        return edges.get(id);
    }

    public synchronized boolean containsNode(Object node) {
        return nodes.contains(node);
    }

    public synchronized boolean containsEdge(Object edge) {
        return edges.contains(edge);
    }

    public synchronized List<Node> getNodes() {
        return nodes.values();
    }

    public synchronized List<Edge> getEdges() {
        return edges.values();
    }

    public synchronized int nodeCount() {
        return nodes.size();
    }

    public synchronized int edgeCount() {
        return edges.size();
    }

    public synchronized boolean isEmpty() {
        return nodes.isEmpty();
    }

    /**
     * Lists the edges touching a node in the given direction, in insertion order.
     *
     * @param node      the node or its id
     * @param direction which edges to return
     * @return the edges, incoming first when {@code BOTH}
     * @throws ItemNotFoundException if the node is not a member
     */
    public synchronized List<Edge> findNodeEdges(Object node, Direction direction) {
        Relations rel = relationsOf(node);
        List<Edge> result = new ArrayList<>();
        if (direction != Direction.OUT) {
            rel.in.keySet().forEach(edgeId -> result.add(edges.get(edgeId)));
        }
        if (direction != Direction.IN) {
            rel.out.keySet().forEach(edgeId -> result.add(edges.get(edgeId)));
        }
        return result;
    }

    /**
     * Returns the nodes without incoming edges, in node insertion order.
     *
     * @return the head nodes
     */
    public synchronized List<Node> getHeads() {
        List<Node> heads = new ArrayList<>();
        for (Node node : nodes) {
            if (relations.get(node.getId()).in.isEmpty()) {
                heads.add(node);
            }
        }
        return heads;
    }

    public synchronized List<Node> getPredecessors(Object node) {
        return resolve(relationsOf(node).in.values());
    }

    public synchronized List<Node> getSuccessors(Object node) {
        return resolve(relationsOf(node).out.values());
    }

    /**
     * Checks that the graph has no directed cycle, self loops included.
     *
     * @return true if acyclic
     */
    public synchronized boolean isAcyclic() {
        Map<String, Mark> marks = new HashMap<>();
        for (String start : nodes.keys()) {
            if (marks.containsKey(start)) {
                continue;
            }
            Deque<Frame> stack = new ArrayDeque<>();
            marks.put(start, Mark.ON_PATH);
            stack.push(new Frame(start, successorIds(start)));
            while (!stack.isEmpty()) {
                Frame top = stack.peek();
                if (!top.successors().hasNext()) {
                    marks.put(top.nodeId(), Mark.DONE);
                    stack.pop();
                    continue;
                }
                String next = top.successors().next();
                Mark mark = marks.get(next);
                if (mark == Mark.ON_PATH) {
                    return false;
                }
                if (mark == null) {
                    marks.put(next, Mark.ON_PATH);
                    stack.push(new Frame(next, successorIds(next)));
                }
            }
        }
        return true;
    }

    /**
     * Removes every node and edge.
     */
    public synchronized void clear() {
        edges.clear();
        nodes.clear();
        relations.clear();
    }

    @Override
    public String toString() {
        return "Graph{id=" + getId() + ", nodes=" + nodeCount() + ", edges=" + edgeCount() + "}";
    }

    private void unlink(Edge edge) {
        Relations head = relations.get(edge.getHead());
        Relations tail = relations.get(edge.getTail());
        if (head != null) {
            head.out.remove(edge.getId());
        }
        if (tail != null) {
            tail.in.remove(edge.getId());
        }
    }

    private Relations relationsOf(Object node) {
        String id = IdType.of(node);
        Relations rel = relations.get(id);
        if (rel == null) {
            throw new ItemNotFoundException(id, "Node not found in graph: " + id);
        }
        return rel;
    }

    private List<Node> resolve(Iterable<String> nodeIds) {
        List<Node> result = new ArrayList<>();
        for (String nodeId : nodeIds) {
            result.add(nodes.get(nodeId));
        }
        return result;
    }

    private Iterator<String> successorIds(String nodeId) {
        return List.copyOf(relations.get(nodeId).out.values()).iterator();
    }

    private enum Mark {
        ON_PATH,
        DONE
    }

    private record Frame(String nodeId, Iterator<String> successors) {
    }

    private static final class Relations {
        private final Map<String, String> in = new LinkedHashMap<>();
        private final Map<String, String> out = new LinkedHashMap<>();
    }
}
