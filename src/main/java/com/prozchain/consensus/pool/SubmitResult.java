package com.prozchain.consensus.pool;

import jakarta.annotation.Nullable;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Outcome of {@link VotePool#submit}. An accepted message may still be {@code conflicting}: it was stored as
 * misbehaviour proof but does not count towards any quorum.
 */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public class SubmitResult {

    public enum Status {
        ACCEPTED,
        DUPLICATE,
        REJECTED
    }

    private static final SubmitResult ACCEPTED = new SubmitResult(Status.ACCEPTED, null, false);
    private static final SubmitResult CONFLICTING = new SubmitResult(Status.ACCEPTED, null, true);
    private static final SubmitResult DUPLICATE = new SubmitResult(Status.DUPLICATE, null, false);

    private final Status status;
    @Nullable
    private final RejectReason reason;
    private final boolean conflicting;

    public static SubmitResult accepted() {
        return ACCEPTED;
    }

    public static SubmitResult conflicting() {
        return CONFLICTING;
    }

    public static SubmitResult duplicate() {
        return DUPLICATE;
    }

    public static SubmitResult rejected(RejectReason reason) {
        return new SubmitResult(Status.REJECTED, reason, false);
    }

    public boolean isAccepted() {
        return status == Status.ACCEPTED;
    }

    public boolean isDuplicate() {
        return status == Status.DUPLICATE;
    }

    public boolean isRejected() {
        return status == Status.REJECTED;
    }

    @Override
    public String toString() {
        if (reason != null) {
            return status + "(" + reason + ")";
        }
        return conflicting ? status + "(conflicting)" : status.toString();
    }
}
