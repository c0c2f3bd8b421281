package com.trellissystems.mailbox;

import com.trellissystems.ItemNotFoundException;
import com.trellissystems.collections.Pile;
import com.trellissystems.collections.Progression;
import com.trellissystems.mailbox.config.MailManagerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Routes mail between registered actors.
 *
 * <p>{@link #collect(String)} drains a sender's outbox and files each mail under
 * {@code recipient -> sender -> progression of mail ids}; {@link #send(String)} moves every
 * sender bucket of a recipient into that recipient's inbox and drops the drained buckets.
 * Delivery is FIFO per (sender, recipient) pair; nothing is guaranteed across senders.
 */
public class MailManager {

    private static final Logger logger = LoggerFactory.getLogger(MailManager.class);

    private final Pile<Actor> sources = new Pile<>();
    private final Pile<Mail> inFlight = new Pile<>(Set.of(Mail.class));
    private final Map<String, Map<String, Progression>> mails = new HashMap<>();
    private final MailManagerConfig config;
    private volatile boolean stopped = false;

    public MailManager() {
        this(new MailManagerConfig());
    }

    public MailManager(MailManagerConfig config) {
        this.config = config;
    }

    public MailManager(Collection<? extends Actor> sources) {
        this(new MailManagerConfig());
        addSources(sources);
    }

    /**
     * Creates a mail without posting it anywhere.
     *
     * @param senderId    the sender id
     * @param recipientId the recipient id
     * @param content     the package
     * @return the new mail
     */
    public static Mail createMail(String senderId, String recipientId, MailPackage content) {
        return new Mail(senderId, recipientId, content);
    }

    /**
     * Registers actors. Already registered actors are left untouched.
     *
     * @param actors the actors to register
     */
    public synchronized void addSources(Collection<? extends Actor> actors) {
        for (Actor actor : actors) {
            addSource(actor);
        }
    }

    public synchronized void addSource(Actor actor) {
        sources.include(actor);
        mails.putIfAbsent(actor.getId(), new LinkedHashMap<>());
        logger.debug("Registered source {}", actor.getId());
    }

    /**
     * Unregisters an actor and drops the mail still waiting for it.
     *
     * @param sourceId the actor id
     * @throws ItemNotFoundException if the actor is not registered
     */
    public synchronized void deleteSource(String sourceId) {
        if (!sources.contains(sourceId)) {
            throw new ItemNotFoundException(sourceId, "Source " + sourceId + " does not exist");
        }
        sources.pop(sourceId);
        Map<String, Progression> dropped = mails.remove(sourceId);
        if (dropped != null) {
            dropped.values().forEach(bucket -> bucket.forEach(inFlight::exclude));
        }
        logger.debug("Removed source {}", sourceId);
    }

    public synchronized boolean hasSource(String sourceId) {
        return sources.contains(sourceId);
    }

    public synchronized List<Actor> getSources() {
        return sources.values();
    }

    /**
     * Drains the outbox of a sender and files every mail under its recipient.
     * Mail addressed to an unknown recipient is dropped and reported after the others are filed.
     *
     * @param senderId the sender id
     * @throws ItemNotFoundException if the sender, or the recipient of one of its mails, is unknown
     */
    public synchronized void collect(String senderId) {
        Actor sender = requireSource(senderId, "Sender");
        List<String> unknownRecipients = new ArrayList<>();
        for (Mail mail : sender.getMailbox().drainOutbound()) {
            Map<String, Progression> byRecipient = mails.get(mail.getRecipient());
            if (byRecipient == null) {
                logger.warn("Dropping mail {} from {}: recipient {} is not registered",
                        mail.getId(), senderId, mail.getRecipient());
                unknownRecipients.add(mail.getRecipient());
                continue;
            }
            inFlight.include(mail);
            byRecipient.computeIfAbsent(senderId, id -> new Progression(id)).append(mail);
            logger.debug("Collected {}", mail);
        }
        if (!unknownRecipients.isEmpty()) {
            throw new ItemNotFoundException(unknownRecipients.get(0),
                    "Recipient source " + unknownRecipients.get(0) + " does not exist");
        }
    }

    /**
     * Moves every pending mail of a recipient into its inbox.
     *
     * @param recipientId the recipient id
     * @throws ItemNotFoundException if the recipient is unknown
     */
    public synchronized void send(String recipientId) {
        Actor recipient = requireSource(recipientId, "Recipient");
        Map<String, Progression> bySender = mails.get(recipientId);
        for (Progression bucket : bySender.values()) {
            for (String mailId : bucket) {
                Mail mail = inFlight.pop(mailId);
                recipient.getMailbox().deliver(mail);
                logger.debug("Delivered {}", mail);
            }
        }
        bySender.clear();
    }

    public synchronized void collectAll() {
        for (String sourceId : sources.keys()) {
            collect(sourceId);
        }
    }

    public synchronized void sendAll() {
        for (String sourceId : sources.keys()) {
            send(sourceId);
        }
    }

    /**
     * Returns the number of mails waiting for a recipient.
     *
     * @param recipientId the recipient id
     * @return the pending count
     */
    public synchronized int pendingFor(String recipientId) {
        requireSource(recipientId, "Recipient");
        int count = 0;
        for (Progression bucket : mails.get(recipientId).values()) {
            count += bucket.size();
        }
        return count;
    }

    /**
     * Returns the pending mail ids of a recipient, per sender.
     *
     * @param recipientId the recipient id
     * @return a snapshot of the buckets
     */
    public synchronized Map<String, List<String>> pendingBuckets(String recipientId) {
        requireSource(recipientId, "Recipient");
        Map<String, List<String>> snapshot = new LinkedHashMap<>();
        mails.get(recipientId).forEach((sender, bucket) -> snapshot.put(sender, bucket.toList()));
        return snapshot;
    }

    /**
     * Runs collect/send rounds at the configured interval until {@link #stop()} is called.
     */
    public void execute() {
        execute(config.getRefreshInterval());
    }

    /**
     * Runs collect/send rounds until {@link #stop()} is called.
     * An interrupt ends the loop with the interrupt flag restored.
     *
     * @param refreshInterval pause between rounds
     */
    public void execute(Duration refreshInterval) {
        logger.info("Mail manager started with refresh interval {}", refreshInterval);
        while (!stopped) {
            collectAll();
            sendAll();
            try {
                Thread.sleep(refreshInterval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Mail manager interrupted, leaving execution loop");
                break;
            }
        }
        logger.info("Mail manager stopped");
    }

    public void stop() {
        stopped = true;
    }

    public boolean isStopped() {
        return stopped;
    }

    private Actor requireSource(String sourceId, String role) {
        Actor actor = sources.get(sourceId, null);
        if (actor == null) {
            throw new ItemNotFoundException(sourceId, role + " source " + sourceId + " does not exist");
        }
        return actor;
    }
}
