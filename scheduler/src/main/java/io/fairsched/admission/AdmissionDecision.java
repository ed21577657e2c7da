package io.fairsched.admission;

import io.fairsched.core.RejectionReason;

/** Result of {@link AdmissionController#decide}. */
public sealed interface AdmissionDecision permits AdmissionDecision.Accept, AdmissionDecision.Reject {

    /** Admitted; {@code softBackpressure} flags a queue past its soft threshold. */
    record Accept(boolean softBackpressure) implements AdmissionDecision {}

    record Reject(RejectionReason reason, String message) implements AdmissionDecision {}

    default boolean isAccepted() { return this instanceof Accept; }
}
