package io.fairsched.error;

import io.fairsched.core.Task;

/** Receives tasks that ended in {@code FAILED}. */
public interface DeadLetterSink extends AutoCloseable {
    void acceptFailure(String stage, Task task, Throwable e);
    @Override default void close() {}
}
