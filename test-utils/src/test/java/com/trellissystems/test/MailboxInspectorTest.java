package com.trellissystems.test;

import com.trellissystems.mailbox.Mail;
import com.trellissystems.mailbox.MailManager;
import com.trellissystems.mailbox.MailPackage;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MailboxInspectorTest {

    @Test
    void shouldReflectOutboxAndInbox() {
        ProbeActor sender = new ProbeActor();
        ProbeActor receiver = new ProbeActor();
        MailManager manager = new MailManager(List.of(sender, receiver));
        MailboxInspector outbox = MailboxInspector.create(sender);
        MailboxInspector inbox = MailboxInspector.create(receiver);

        Mail mail = sender.send(receiver.getId(), new MailPackage.End(sender.getId()));

        assertEquals(1, outbox.outboundSize());
        assertEquals(List.of(mail.getId()), outbox.pendingOuts());

        manager.collectAll();
        outbox.awaitOutboundDrained(Duration.ofSeconds(1));
        manager.sendAll();
        inbox.awaitInbound(1, Duration.ofSeconds(1));

        assertEquals(List.of(sender.getId()), inbox.pendingSenders());
        assertEquals(List.of(mail.getId()), inbox.pendingIns().get(sender.getId()));
        assertTrue(outbox.isEmpty());
    }

    @Test
    void shouldTimeOutWaitingForInbound() {
        MailboxInspector inspector = MailboxInspector.create(new ProbeActor());

        assertThrows(AssertionError.class, () -> inspector.awaitInbound(1, Duration.ofMillis(50)));
        assertEquals(0, inspector.inboundSize());
    }
}
