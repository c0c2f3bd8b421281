package com.trellissystems.mailbox;

import com.trellissystems.IdType;
import com.trellissystems.ItemNotFoundException;
import com.trellissystems.mailbox.config.MailManagerConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MailManagerTest {

    private static final class SimpleActor extends Actor {
    }

    private SimpleActor x;
    private SimpleActor y;
    private MailManager manager;

    @BeforeEach
    void setUp() {
        x = new SimpleActor();
        y = new SimpleActor();
        manager = new MailManager(List.of(x, y));
    }

    private MailPackage end() {
        return new MailPackage.End(x.getId());
    }

    @Test
    void testCreateMail() {
        Mail mail = MailManager.createMail(x.getId(), y.getId(), end());

        assertEquals(x.getId(), mail.getSender());
        assertEquals(y.getId(), mail.getRecipient());
        assertEquals(MailCategory.END, mail.getCategory());
    }

    @Test
    void testAddSourcesIsIdempotent() {
        manager.addSources(List.of(x, y));

        assertEquals(List.of(x, y), manager.getSources());
    }

    @Test
    void testCollectFilesMailUnderRecipient() {
        Mail m1 = x.send(y.getId(), end());
        Mail m2 = x.send(y.getId(), end());

        manager.collect(x.getId());

        assertEquals(0, x.getMailbox().outboundSize());
        assertEquals(Map.of(x.getId(), List.of(m1.getId(), m2.getId())), manager.pendingBuckets(y.getId()));
    }

    @Test
    void testSendDeliversAndDropsBuckets() {
        Mail m1 = x.send(y.getId(), end());
        Mail m2 = x.send(y.getId(), end());
        manager.collect(x.getId());

        manager.send(y.getId());

        assertEquals(Map.of(x.getId(), List.of(m1.getId(), m2.getId())), y.getMailbox().pendingIns());
        assertTrue(manager.pendingBuckets(y.getId()).isEmpty());
    }

    @Test
    void testMailBetweenPairIsFifo() {
        Mail m1 = x.send(y.getId(), end());
        manager.collectAll();
        Mail m2 = x.send(y.getId(), end());
        manager.collectAll();
        manager.sendAll();

        assertEquals(List.of(m1, m2), y.getMailbox().drainInbound());
    }

    @Test
    void testCollectAllAndSendAllExchangeBothWays() {
        Mail toY = x.send(y.getId(), end());
        Mail toX = y.send(x.getId(), end());

        manager.collectAll();
        manager.sendAll();

        assertEquals(List.of(toY), y.getMailbox().drainInbound());
        assertEquals(List.of(toX), x.getMailbox().drainInbound());
    }

    @Test
    void testUnknownIdsRaise() {
        String unknown = IdType.generate();

        assertThrows(ItemNotFoundException.class, () -> manager.collect(unknown));
        assertThrows(ItemNotFoundException.class, () -> manager.send(unknown));
        assertThrows(ItemNotFoundException.class, () -> manager.deleteSource(unknown));
    }

    @Test
    void testUnknownRecipientRaisesButKeepsOtherMail() {
        String unknown = IdType.generate();
        Mail lost = x.send(unknown, end());
        Mail kept = x.send(y.getId(), end());

        ItemNotFoundException e = assertThrows(ItemNotFoundException.class, () -> manager.collect(x.getId()));

        assertEquals(lost.getRecipient(), e.getKey());
        assertEquals(1, manager.pendingFor(y.getId()));
        manager.send(y.getId());
        assertEquals(List.of(kept), y.getMailbox().drainInbound());
    }

    @Test
    void testSendWithNothingPendingLeavesInboxEmpty() {
        manager.send(x.getId());

        assertFalse(x.getMailbox().hasInbound());
    }

    @Test
    void testDeleteSourceDropsPendingMail() {
        x.send(y.getId(), end());
        manager.collect(x.getId());

        manager.deleteSource(y.getId());

        assertFalse(manager.hasSource(y.getId()));
        assertEquals(List.of(x), manager.getSources());
        assertThrows(ItemNotFoundException.class, () -> manager.pendingFor(y.getId()));
    }

    @Test
    @Timeout(5)
    void testExecuteLoopsUntilStopped() throws Exception {
        MailManager looping = new MailManager(new MailManagerConfig().setRefreshInterval(Duration.ofMillis(10)));
        looping.addSources(List.of(x, y));
        CompletableFuture<Void> run = CompletableFuture.runAsync(looping::execute);

        Mail mail = x.send(y.getId(), end());
        while (!y.getMailbox().hasInbound()) {
            Thread.sleep(5);
        }
        looping.stop();
        run.get(2, TimeUnit.SECONDS);

        assertTrue(looping.isStopped());
        assertEquals(List.of(mail), y.getMailbox().drainInbound());
    }

    @Test
    void testInvalidRefreshIntervalRejected() {
        MailManagerConfig config = new MailManagerConfig();

        assertThrows(IllegalArgumentException.class, () -> config.setRefreshInterval(Duration.ZERO));
        assertEquals(MailManagerConfig.DEFAULT_REFRESH_INTERVAL, config.getRefreshInterval());
    }
}
