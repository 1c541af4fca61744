package io.docmirror.standalone.notify;

import io.docmirror.standalone.runner.RunSummary;

/**
 * Receives the lifecycle events of a mirror run: start, completion and failure.
 *
 * <p>
 * Delivery failures surface as {@link NotificationException}; callers decide whether a failed
 * notification matters. The runner logs and ignores them.
 */
public interface LifecycleNotifier {

    /**
     * Announces that a run has started.
     *
     * @param description short description of the run (schema and input)
     */
    void start(String description) throws NotificationException, InterruptedException;

    /** Announces that a run completed, with its counts. */
    void complete(RunSummary summary) throws NotificationException, InterruptedException;

    /** Announces that a run failed. */
    void error(String message) throws NotificationException, InterruptedException;
}
