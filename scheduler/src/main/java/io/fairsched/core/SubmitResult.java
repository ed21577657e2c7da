package io.fairsched.core;

import java.util.Optional;

/**
 * Outcome of {@code submit}: either accepted with the assigned task id, or rejected with a reason.
 * {@code softBackpressure} is informational and only ever set on accepted results.
 */
public record SubmitResult(long taskId, RejectionReason reason, boolean softBackpressure) {

    public static SubmitResult accepted(long taskId, boolean softBackpressure) {
        return new SubmitResult(taskId, null, softBackpressure);
    }

    public static SubmitResult rejected(RejectionReason reason) {
        return new SubmitResult(0L, reason, false);
    }

    public boolean isAccepted() { return reason == null; }

    public Optional<RejectionReason> rejection() { return Optional.ofNullable(reason); }
}
