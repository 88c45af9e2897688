package com.ryuqq.livesync.core.failure;

import com.ryuqq.livesync.core.model.SubscriptionKey;

/**
 * 원격 피드 열기 실패 또는 피드 비정상 종료.
 *
 * <p>권한 거부, 네트워크 장애, 잘못된 쿼리 등이 원인입니다.
 * 실패한 구독은 레지스트리에 남지 않으므로, 호출자가 다시 구독해야 합니다.</p>
 *
 * @param key 실패한 구독 키
 * @param reason 실패 원인
 * @param message 실패 메시지
 *
 * @author LiveSync Team
 * @since 1.0.0
 */
public record SubscriptionFailed(
    SubscriptionKey key,
    FailureReason reason,
    String message
) implements SyncFailure {

    public SubscriptionFailed {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (reason == null) {
            throw new IllegalArgumentException("reason cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }
}
