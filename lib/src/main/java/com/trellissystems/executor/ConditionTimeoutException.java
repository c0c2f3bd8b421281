package com.trellissystems.executor;

import com.trellissystems.TrellisException;

import java.time.Duration;

/**
 * Thrown when the answer to an executable edge condition does not arrive in time.
 */
public class ConditionTimeoutException extends TrellisException {

    private final String edgeId;
    private final String requestSource;

    public ConditionTimeoutException(String actorId, String edgeId, String requestSource, Duration timeout) {
        super("No answer for condition of edge " + edgeId + " from " + requestSource + " within " + timeout,
                null, actorId);
        this.edgeId = edgeId;
        this.requestSource = requestSource;
    }

    public String getEdgeId() {
        return edgeId;
    }

    public String getRequestSource() {
        return requestSource;
    }
}
