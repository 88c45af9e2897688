package com.ryuqq.livesync.application.registry;

import com.ryuqq.livesync.core.failure.SyncFailure;
import com.ryuqq.livesync.core.model.RemoteDocument;
import com.ryuqq.livesync.core.model.SyncEntity;

import java.util.List;

/**
 * 구독자 콜백.
 *
 * <p>같은 구독 키의 호출은 항상 순차적으로 전달되며, 서로 다른 키는 병렬로 전달될 수 있습니다.</p>
 *
 * @param <T> 엔티티 타입
 *
 * @author LiveSync Team
 * @since 1.0.0
 */
public interface SnapshotCallback<T extends SyncEntity> {

    /**
     * 디코딩된 원격 스냅샷 수신.
     *
     * @param documents 스냅샷 문서 (원격 순서, hasPendingWrites 포함)
     */
    void onSnapshot(List<RemoteDocument<T>> documents);

    /**
     * 구독 실패 또는 디코딩 실패 수신.
     *
     * <p>SubscriptionFailed 이후에는 더 이상 호출되지 않습니다.
     * DecodeFailed 이후에는 다음 스냅샷이 계속 전달됩니다.</p>
     *
     * @param failure 실패
     */
    void onFailure(SyncFailure failure);
}
