package de.upb.sse.opweave.analysis;

import java.util.Objects;
import java.util.Optional;

public final class FilterDecision {
    private static final FilterDecision PASS = new FilterDecision(null);

    private final RejectionReason reason;

    private FilterDecision(RejectionReason reason) {
        this.reason = reason;
    }

    public static FilterDecision pass() {
        return PASS;
    }

    public static FilterDecision reject(RejectionReason reason) {
        return new FilterDecision(Objects.requireNonNull(reason, "reason"));
    }

    public boolean isPassed() {
        return reason == null;
    }

    public Optional<RejectionReason> getReason() {
        return Optional.ofNullable(reason);
    }

    @Override
    public String toString() {
        return isPassed() ? "pass" : "reject(" + reason + ")";
    }
}
