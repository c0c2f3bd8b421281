package com.trellissystems.executor;

import com.trellissystems.TrellisException;

/**
 * Thrown when an executor fails while interpreting a mail.
 * Carries the executor, mail and node involved.
 */
public class TraversalException extends TrellisException {

    private final String mailId;
    private final String nodeId;

    public TraversalException(String message, Throwable cause, String actorId, String mailId, String nodeId) {
        super(message, cause, actorId);
        this.mailId = mailId;
        this.nodeId = nodeId;
    }

    public String getMailId() {
        return mailId;
    }

    /**
     * Returns the node the failing mail referred to.
     *
     * @return the node id, or null if the mail named no node
     */
    public String getNodeId() {
        return nodeId;
    }
}
