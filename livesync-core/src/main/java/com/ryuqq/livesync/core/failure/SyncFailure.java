package com.ryuqq.livesync.core.failure;

/**
 * 동기화 계층의 실패.
 *
 * <p>세 가지 실패만 존재합니다:</p>
 * <ul>
 *   <li>{@link SubscriptionFailed}: 원격 피드를 열 수 없거나 피드가 오류로 종료됨</li>
 *   <li>{@link DecodeFailed}: 스냅샷 내 문서를 엔티티로 변환할 수 없음</li>
 *   <li>{@link WriteFailed}: 원격 저장소가 로컬 쓰기를 거부함</li>
 * </ul>
 *
 * <p>어느 실패도 프로세스에 치명적이지 않으며, 해당 구독/쓰기를 요청한 호출자에게만 전달됩니다.
 * 이 계층은 자동 재시도를 하지 않습니다.</p>
 *
 * @author LiveSync Team
 * @since 1.0.0
 */
public sealed interface SyncFailure permits SubscriptionFailed, DecodeFailed, WriteFailed {

    /**
     * 실패 원인 분류.
     *
     * @return FailureReason
     */
    FailureReason reason();

    /**
     * 사람이 읽을 수 있는 실패 메시지.
     *
     * @return 메시지
     */
    String message();

    default boolean isSubscriptionFailed() {
        return this instanceof SubscriptionFailed;
    }

    default boolean isDecodeFailed() {
        return this instanceof DecodeFailed;
    }

    default boolean isWriteFailed() {
        return this instanceof WriteFailed;
    }
}
