package com.ryuqq.livesync.core.failure;

import com.ryuqq.livesync.core.model.EntityId;
import com.ryuqq.livesync.core.model.SubscriptionKey;

/**
 * 스냅샷 문서 디코딩 실패.
 *
 * <p>해당 스냅샷 전체가 해당 구독자에게 전달되지 않으며, 다른 구독자/구독에는 영향이 없습니다.</p>
 *
 * @param key 스냅샷을 받은 구독 키
 * @param documentId 디코딩에 실패한 문서 ID
 * @param message 실패 메시지
 *
 * @author LiveSync Team
 * @since 1.0.0
 */
public record DecodeFailed(
    SubscriptionKey key,
    EntityId documentId,
    String message
) implements SyncFailure {

    public DecodeFailed {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (documentId == null) {
            throw new IllegalArgumentException("documentId cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }

    /**
     * 디코딩 실패는 항상 데이터 형식 문제로 분류합니다.
     *
     * @return {@link FailureReason#UNKNOWN}
     */
    @Override
    public FailureReason reason() {
        return FailureReason.UNKNOWN;
    }
}
