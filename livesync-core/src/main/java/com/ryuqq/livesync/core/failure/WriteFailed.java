package com.ryuqq.livesync.core.failure;

import com.ryuqq.livesync.core.model.EntityId;
import com.ryuqq.livesync.core.pending.MutationKind;

/**
 * 원격 저장소가 로컬 쓰기를 거부함.
 *
 * <p>이 실패를 받은 호출자는 TTL을 기다리지 않고 자신의 PendingMutation을 즉시 제거해야 합니다.
 * 그렇지 않으면 다음 병합에서 존재하지 않는 낙관적 값이 계속 노출됩니다.</p>
 *
 * @param entityId 쓰기 대상 엔티티 (REORDER_BATCH는 null)
 * @param kind 실패한 쓰기 종류
 * @param reason 실패 원인
 * @param message 실패 메시지
 *
 * @author LiveSync Team
 * @since 1.0.0
 */
public record WriteFailed(
    EntityId entityId,
    MutationKind kind,
    FailureReason reason,
    String message
) implements SyncFailure {

    public WriteFailed {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (kind.isEntityScoped() && entityId == null) {
            throw new IllegalArgumentException("entityId cannot be null for " + kind);
        }
        if (reason == null) {
            throw new IllegalArgumentException("reason cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }
}
