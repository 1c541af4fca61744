package io.docmirror.standalone.notify;

import io.docmirror.standalone.runner.RunSummary;

/** Notifier used when notifications are disabled. */
public final class NoopNotifier implements LifecycleNotifier {

    public static final NoopNotifier INSTANCE = new NoopNotifier();

    private NoopNotifier() {}

    @Override
    public void start(String description) {}

    @Override
    public void complete(RunSummary summary) {}

    @Override
    public void error(String message) {}
}
