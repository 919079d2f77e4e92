package com.example.gateway.session.connection;

/**
 * Outcomes of a {@link ConnectionStateMachine} that the owner has to act on. Called with the
 * tenant lock held; implementations must not block.
 */
public interface ConnectionLifecycleListener {

    void onConnected(String tenantId);

    /**
     * The connection dropped for a reason that may heal.
     *
     * @param attempt the attempt that dropped; pass it back to
     *                {@link ConnectionStateMachine#reconnect(long)}
     */
    void onUnexpectedDisconnect(String tenantId, long attempt);

    /**
     * The session reached a sink state on its own (remote logout, fatal fault, retries
     * exhausted).
     */
    void onTerminated(String tenantId);
}
