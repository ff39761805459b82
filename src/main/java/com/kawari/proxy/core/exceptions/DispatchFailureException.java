package com.kawari.proxy.core.exceptions;

import com.kawari.proxy.core.rotation.BackendDescriptor;
import com.kawari.proxy.core.rotation.DispatchAttempt;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.List;

/**
 * Terminal failure of a dispatch after every allowed attempt failed at the connection level.
 * The cause is the transport error of the last attempt.
 */
public class DispatchFailureException extends ProxyException {
    private final transient List<DispatchAttempt> history;

    /**
     * @param history   every failed attempt in order; must not be empty.
     * @param lastError transport error of the final attempt.
     */
    public DispatchFailureException(List<DispatchAttempt> history, Throwable lastError) {
        super(buildMessage(history, lastError), lastError);
        this.history = List.copyOf(history);
    }

    private static String buildMessage(List<DispatchAttempt> history, Throwable lastError) {
        DispatchAttempt last = history.get(history.size() - 1);
        return "Dispatch failed after " + history.size() + " attempt(s); last backend "
                + (last.backend() != null ? last.backend() : "direct") + ": "
                + (lastError != null ? lastError.getMessage() : last.error());
    }

    public int getAttempts() {
        return history.size();
    }

    public List<DispatchAttempt> getHistory() {
        return history;
    }

    public String getLastIdentity() {
        return history.get(history.size() - 1).identity();
    }

    public BackendDescriptor getLastBackend() {
        return history.get(history.size() - 1).backend();
    }

    /**
     * @return true if the last attempt ran out of time rather than failing to connect.
     */
    public boolean isTimeout() {
        Throwable cause = getCause();
        return cause instanceof HttpTimeoutException || cause instanceof SocketTimeoutException;
    }
}
