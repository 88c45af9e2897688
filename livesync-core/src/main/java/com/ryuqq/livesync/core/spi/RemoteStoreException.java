package com.ryuqq.livesync.core.spi;

import com.ryuqq.livesync.core.failure.FailureReason;

/**
 * Failure reported by a {@link RemoteStore}.
 *
 * <p>Thrown synchronously by {@link RemoteStore#subscribe}, delivered to
 * {@link FeedListener#onError}, or used to complete a commit future exceptionally.</p>
 *
 * @author LiveSync Team
 * @since 1.0.0
 */
public class RemoteStoreException extends RuntimeException {

    private final FailureReason reason;

    public RemoteStoreException(FailureReason reason, String message) {
        super(message);
        this.reason = requireReason(reason);
    }

    public RemoteStoreException(FailureReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = requireReason(reason);
    }

    /**
     * Returns the failure classification.
     *
     * @return the reason (never null)
     */
    public FailureReason getReason() {
        return reason;
    }

    private static FailureReason requireReason(FailureReason reason) {
        if (reason == null) {
            throw new IllegalArgumentException("reason cannot be null");
        }
        return reason;
    }
}
