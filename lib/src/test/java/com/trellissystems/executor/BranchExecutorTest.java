package com.trellissystems.executor;

import com.trellissystems.action.ActionBundles;
import com.trellissystems.action.ActionNode;
import com.trellissystems.action.ActionSelection;
import com.trellissystems.action.Tool;
import com.trellissystems.action.ToolNode;
import com.trellissystems.graph.Edge;
import com.trellissystems.graph.EdgeCondition;
import com.trellissystems.graph.Node;
import com.trellissystems.mailbox.Mail;
import com.trellissystems.mailbox.MailCategory;
import com.trellissystems.mailbox.MailManager;
import com.trellissystems.mailbox.MailPackage;
import com.trellissystems.test.AsyncAssertion;
import com.trellissystems.test.ProbeActor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class BranchExecutorTest {

    private static final Duration WAIT = Duration.ofSeconds(1);

    private NodeProcessor processor;
    private BranchExecutor branch;
    private ProbeActor structure;
    private MailManager manager;

    @BeforeEach
    void setUp() {
        processor = mock(NodeProcessor.class);
        when(processor.perform(any(Node.class), anyMap())).thenReturn(CompletableFuture.completedFuture("done"));
        branch = new BranchExecutor(processor);
        structure = new ProbeActor();
        manager = new MailManager(List.of(branch, structure));
    }

    private void route() {
        manager.collectAll();
        manager.sendAll();
    }

    private void deliver(MailPackage content) {
        structure.send(branch.getId(), content);
        route();
        branch.forward();
        route();
    }

    @Test
    void testRequestStartCarriesTheContext() {
        branch.getContext().put("topic", "graphs");

        branch.requestStart(structure.getId());
        route();

        MailPackage.Start start = structure.expectPackage(MailPackage.Start.class, WAIT);
        assertEquals(branch.getId(), start.requestSource());
        assertEquals(Map.of("topic", "graphs"), start.context());
    }

    @Test
    void testPerformsNodeAndReportsItsId() {
        Node node = new Node("summarize");
        branch.getContext().put("step", 1);

        deliver(new MailPackage.NodeDelivery(branch.getId(), node));

        MailPackage.NodeIdDelivery reply = structure.expectPackage(MailPackage.NodeIdDelivery.class, WAIT);
        assertEquals(node.getId(), reply.nodeId());
        assertEquals(branch.getId(), reply.requestSource());
        verify(processor).perform(eq(node), anyMap());
        assertEquals(List.of(new BranchExecutor.ExecutionRecord(node.getId(), null, "done")), branch.getExecutionLog());
        assertEquals(List.of(Map.of("step", 1)), branch.getContextLog());
        assertEquals(List.of("done"), branch.getResults());
    }

    @Test
    void testToolsRunInOrderBeforeTheProcessor() {
        Tool fetch = mock(Tool.class);
        when(fetch.name()).thenReturn("fetch");
        when(fetch.perform(anyMap())).thenReturn(CompletableFuture.completedFuture("raw"));
        Tool parse = mock(Tool.class);
        when(parse.name()).thenReturn("parse");
        when(parse.perform(anyMap())).thenReturn(CompletableFuture.completedFuture("parsed"));
        Node instruction = new Node("read the page");
        ActionNode action = ActionBundles.merge(instruction, List.of(
                new ToolNode(fetch), new ToolNode(parse), new ActionSelection("extract", Map.of("url", "u"))));

        deliver(new MailPackage.NodeDelivery(branch.getId(), action));

        ArgumentCaptor<Map<String, Object>> fetchArgs = ArgumentCaptor.forClass(Map.class);
        ArgumentCaptor<Map<String, Object>> parseArgs = ArgumentCaptor.forClass(Map.class);
        verify(fetch).perform(fetchArgs.capture());
        verify(parse).perform(parseArgs.capture());
        assertEquals(Map.of("url", "u"), fetchArgs.getValue());
        assertEquals(Map.of("url", "u", BranchExecutor.INPUT_KEY, "raw"), parseArgs.getValue());
        verify(processor).perform(eq(action), anyMap());
        assertEquals("parsed", branch.getContext().get(BranchExecutor.INPUT_KEY));

        MailPackage.NodeIdDelivery reply = structure.expectPackage(MailPackage.NodeIdDelivery.class, WAIT);
        assertEquals(instruction.getId(), reply.nodeId());
        BranchExecutor.ExecutionRecord record = branch.getExecutionLog().get(0);
        assertEquals("extract", record.action());
        assertEquals(instruction.getId(), record.nodeId());
        assertEquals(Map.of("fetch", fetch, "parse", parse), branch.getRegisteredTools());
    }

    @Test
    void testAnswersConditionAgainstItsOwnState() {
        branch.getContext().put("ready", true);
        Node from = new Node("from");
        Node to = new Node("to");
        Edge edge = new Edge(from, to,
                EdgeCondition.onExecutable(BranchExecutor.class, b -> b.getContext().containsKey("ready")),
                false, null);

        deliver(new MailPackage.ConditionRequest(branch.getId(), edge));

        MailPackage.ConditionReply reply = structure.expectPackage(MailPackage.ConditionReply.class, WAIT);
        assertEquals(edge.getId(), reply.edgeId());
        assertTrue(reply.result());
        verifyNoInteractions(processor);
    }

    @Test
    void testEndStopsAndIsAcknowledged() {
        deliver(new MailPackage.End(branch.getId()));

        Mail ack = structure.expectMail(MailCategory.END, WAIT);
        assertEquals(branch.getId(), ack.getPackage().requestSource());
        assertTrue(branch.isStopped());

        deliver(new MailPackage.NodeDelivery(branch.getId(), new Node("late")));
        structure.expectNoMail(Duration.ofMillis(50));
        verifyNoInteractions(processor);
    }

    @Test
    void testStartIsRejected() {
        structure.send(branch.getId(), new MailPackage.Start(structure.getId()));
        route();

        TraversalException error = assertThrows(TraversalException.class, branch::forward);
        assertInstanceOf(IllegalArgumentException.class, error.getCause());
    }

    @Test
    void testFailedNodeIsThrownRightAway() {
        Node node = new Node("broken");
        when(processor.perform(eq(node), anyMap()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("model unavailable")));
        structure.send(branch.getId(), new MailPackage.NodeDelivery(branch.getId(), node));
        route();

        TraversalException error = assertThrows(TraversalException.class, branch::forward);
        assertInstanceOf(IllegalStateException.class, error.getCause());
        assertEquals(node.getId(), error.getNodeId());
        assertTrue(branch.getExecutionLog().isEmpty());
    }

    @Test
    void testLateFailureIsThrownByNextForward() {
        Node node = new Node("slow");
        CompletableFuture<Object> result = new CompletableFuture<>();
        when(processor.perform(eq(node), anyMap())).thenReturn(result);

        deliver(new MailPackage.NodeDelivery(branch.getId(), node));
        assertFalse(branch.hasPendingFailure());

        result.completeExceptionally(new RuntimeException("timed out upstream"));

        AsyncAssertion.eventually(branch::hasPendingFailure, WAIT);
        TraversalException error = assertThrows(TraversalException.class, branch::forward);
        assertEquals("timed out upstream", error.getCause().getMessage());
        assertFalse(branch.hasPendingFailure());
    }

    @Test
    void testCloneBranchCopiesStateIndependently() {
        branch.getContext().put("k", "v");
        deliver(new MailPackage.NodeDelivery(branch.getId(), new Node("first")));

        BranchExecutor clone = branch.cloneBranch();
        clone.getContext().put("k", "changed");

        assertNotEquals(branch.getId(), clone.getId());
        assertEquals("v", branch.getContext().get("k"));
        assertEquals(branch.getExecutionLog(), clone.getExecutionLog());
        assertEquals(branch.getContextLog(), clone.getContextLog());
        assertTrue(clone.getMailbox().isEmpty());
    }
}
