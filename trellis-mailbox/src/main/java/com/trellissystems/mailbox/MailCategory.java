package com.trellissystems.mailbox;

/**
 * Closed set of mail categories understood by the traversal engine.
 */
public enum MailCategory {
    START,
    END,
    NODE,
    NODE_LIST,
    NODE_ID,
    CONDITION
}
