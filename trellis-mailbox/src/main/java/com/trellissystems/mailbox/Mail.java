package com.trellissystems.mailbox;

import com.trellissystems.Element;
import com.trellissystems.IdType;

import java.util.Objects;

/**
 * Immutable envelope addressed from one actor to another.
 */
public final class Mail extends Element {

    private final String sender;
    private final String recipient;
    private final MailPackage content;

    public Mail(String sender, String recipient, MailPackage content) {
        this.sender = IdType.of(sender);
        this.recipient = IdType.of(recipient);
        this.content = Objects.requireNonNull(content, "package cannot be null");
    }

    public String getSender() {
        return sender;
    }

    public String getRecipient() {
        return recipient;
    }

    public MailPackage getPackage() {
        return content;
    }

    public MailCategory getCategory() {
        return content.category();
    }

    /**
     * Creates a new mail carrying the same package between other actors.
     *
     * @param newSender    the sender id
     * @param newRecipient the recipient id
     * @return a new mail with a fresh id
     */
    public Mail readdress(String newSender, String newRecipient) {
        return new Mail(newSender, newRecipient, content);
    }

    @Override
    public String toString() {
        return "Mail{id=" + getId() + ", " + getCategory() + ", " + sender + " -> " + recipient + "}";
    }
}
