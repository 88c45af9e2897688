/**
 * 동기화 실패 분류 패키지.
 *
 * <p>{@link com.ryuqq.livesync.core.failure.SyncFailure} sealed interface와
 * 세 가지 구현(SubscriptionFailed, DecodeFailed, WriteFailed)을 정의합니다.
 * 실패는 예외로 던지지 않고 콜백을 통해 값으로 전달됩니다.</p>
 *
 * @author LiveSync Team
 * @since 1.0.0
 */
package com.ryuqq.livesync.core.failure;
