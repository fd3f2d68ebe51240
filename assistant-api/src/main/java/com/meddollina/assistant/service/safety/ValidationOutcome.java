package com.meddollina.assistant.service.safety;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of the relevance gate: allowed, rejected with a user-visible message, or a
 * validation error when the screening call itself failed.
 */
public record ValidationOutcome(Kind kind, Optional<RejectionReason> reason, String message) {

    public enum Kind {
        ALLOWED,
        REJECTED,
        ERROR
    }

    public enum RejectionReason {
        MISCONDUCT,
        MALICIOUS,
        FAREWELL,
        SALUTATION,
        NOT_RELEVANT,
        MALFORMED_RESPONSE;

        public boolean blocking() {
            return this == MISCONDUCT || this == MALICIOUS;
        }
    }

    public ValidationOutcome {
        Objects.requireNonNull(kind, "kind");
        reason = reason == null ? Optional.empty() : reason;
        message = message == null ? "" : message;
    }

    public static ValidationOutcome allowed() {
        return new ValidationOutcome(Kind.ALLOWED, Optional.empty(), "");
    }

    public static ValidationOutcome rejected(RejectionReason reason, String message) {
        return new ValidationOutcome(Kind.REJECTED, Optional.of(reason), message);
    }

    public static ValidationOutcome error(String detail) {
        return new ValidationOutcome(Kind.ERROR, Optional.empty(), detail);
    }

    static ValidationOutcome fromVerdict(SafetyVerdict verdict) {
        RejectionReason reason = switch (verdict) {
            case SEXUAL_MISCONDUCT -> RejectionReason.MISCONDUCT;
            case MALICIOUS_INTENT -> RejectionReason.MALICIOUS;
            case FAREWELL -> RejectionReason.FAREWELL;
        };
        return rejected(reason, verdict.message());
    }

    public boolean isAllowed() {
        return kind == Kind.ALLOWED;
    }

    public boolean blocked() {
        return reason.map(RejectionReason::blocking).orElse(false);
    }
}
