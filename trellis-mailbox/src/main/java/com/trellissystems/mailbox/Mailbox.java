package com.trellissystems.mailbox;

import com.trellissystems.collections.Pile;
import com.trellissystems.collections.Progression;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Inbox and outbox of an actor.
 *
 * <p>Mails are stored once in a pile; the inbox keeps one progression of mail ids per sender,
 * the outbox a single progression. Methods are synchronized so a mail manager thread and the
 * owning actor's thread can share a mailbox.
 */
public class Mailbox {

    private final Pile<Mail> mails = new Pile<>(Set.of(Mail.class));
    private final Map<String, Progression> pendingIns = new LinkedHashMap<>();
    private final Progression pendingOuts = new Progression("outbox");

    /**
     * Queues a mail for collection by the mail manager.
     *
     * @param mail the outgoing mail
     */
    public synchronized void post(Mail mail) {
        mails.include(mail);
        pendingOuts.append(mail);
    }

    /**
     * Files an incoming mail under its sender.
     *
     * @param mail the incoming mail
     */
    public synchronized void deliver(Mail mail) {
        mails.include(mail);
        pendingIns.computeIfAbsent(mail.getSender(), sender -> new Progression(sender)).append(mail);
    }

    /**
     * Removes and returns every outgoing mail in posting order.
     *
     * @return the outgoing mails
     */
    public synchronized List<Mail> drainOutbound() {
        List<Mail> drained = new ArrayList<>(pendingOuts.size());
        for (String mailId : pendingOuts) {
            drained.add(mails.pop(mailId));
        }
        pendingOuts.clear();
        return drained;
    }

    /**
     * Removes and returns every incoming mail. Mails from one sender keep their arrival order;
     * senders are visited in the order their first pending mail arrived.
     *
     * @return the incoming mails
     */
    public synchronized List<Mail> drainInbound() {
        List<Mail> drained = new ArrayList<>();
        Iterator<Progression> buckets = pendingIns.values().iterator();
        while (buckets.hasNext()) {
            for (String mailId : buckets.next()) {
                drained.add(mails.pop(mailId));
            }
            buckets.remove();
        }
        return drained;
    }

    /**
     * Removes and returns the incoming mails of one sender.
     *
     * @param senderId the sender id
     * @return the mails, empty if none are pending
     */
    public synchronized List<Mail> drainInbound(String senderId) {
        Progression bucket = pendingIns.remove(senderId);
        if (bucket == null) {
            return List.of();
        }
        List<Mail> drained = new ArrayList<>(bucket.size());
        for (String mailId : bucket) {
            drained.add(mails.pop(mailId));
        }
        return drained;
    }

    /**
     * Returns the pending inbound mail ids per sender.
     *
     * @return a snapshot of the inbox
     */
    public synchronized Map<String, List<String>> pendingIns() {
        Map<String, List<String>> snapshot = new LinkedHashMap<>();
        pendingIns.forEach((sender, bucket) -> snapshot.put(sender, bucket.toList()));
        return snapshot;
    }

    public synchronized List<String> pendingOuts() {
        return pendingOuts.toList();
    }

    public synchronized int inboundSize() {
        int size = 0;
        for (Progression bucket : pendingIns.values()) {
            size += bucket.size();
        }
        return size;
    }

    public synchronized int outboundSize() {
        return pendingOuts.size();
    }

    public synchronized boolean hasInbound() {
        return !pendingIns.isEmpty();
    }

    public synchronized boolean isEmpty() {
        return mails.isEmpty();
    }
}
