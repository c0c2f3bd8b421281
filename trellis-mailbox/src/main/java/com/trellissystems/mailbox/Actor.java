package com.trellissystems.mailbox;

import com.trellissystems.Element;

/**
 * Addressable unit that exchanges mail through a {@link MailManager}.
 * The manager moves mail between the outbox and inbox of registered actors.
 */
public abstract class Actor extends Element {

    private final Mailbox mailbox = new Mailbox();

    public Mailbox getMailbox() {
        return mailbox;
    }

    /**
     * Posts a package to another actor. The mail stays in this actor's outbox until the
     * mail manager collects it.
     *
     * @param recipientId the recipient id
     * @param content     the package
     * @return the posted mail
     */
    public Mail send(String recipientId, MailPackage content) {
        Mail mail = MailManager.createMail(getId(), recipientId, content);
        mailbox.post(mail);
        return mail;
    }
}
