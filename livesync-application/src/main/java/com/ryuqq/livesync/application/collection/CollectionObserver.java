package com.ryuqq.livesync.application.collection;

import com.ryuqq.livesync.core.failure.SyncFailure;
import com.ryuqq.livesync.core.model.SyncEntity;

import java.util.List;

/**
 * {@link SyncedCollection} 변경 관찰자.
 *
 * @param <T> 엔티티 타입
 *
 * @author LiveSync Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface CollectionObserver<T extends SyncEntity> {

    /**
     * 병합된 목록 수신.
     *
     * @param entities 현재 목록 (불변)
     */
    void onChange(List<T> entities);

    /**
     * 구독/디코딩/쓰기 실패 수신. 기본 구현은 무시합니다.
     *
     * @param failure 실패
     */
    default void onFailure(SyncFailure failure) {
    }
}
