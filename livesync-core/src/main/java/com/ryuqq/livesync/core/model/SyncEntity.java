package com.ryuqq.livesync.core.model;

import java.util.Comparator;

/**
 * 동기화 대상 도메인 엔티티 (태스크, 태스크 리스트, 패밀리, 페이즈 등).
 *
 * <p>이 서브시스템은 식별자와 order만 해석하며, 나머지 도메인 필드는 불투명(opaque)하게 취급합니다.</p>
 *
 * <p><strong>불변식:</strong> 하나의 논리 컬렉션 안에서 order 값은 유일하며 전순서를 이룹니다.
 * 동일한 order는 식별자 문자열 비교로 tie-break 합니다 ({@link #ORDERING}).</p>
 *
 * @author LiveSync Team
 * @since 1.0.0
 */
public interface SyncEntity {

    /**
     * order 오름차순, 동일 order는 식별자 오름차순.
     */
    Comparator<SyncEntity> ORDERING = Comparator
        .comparingInt(SyncEntity::order)
        .thenComparing(SyncEntity::id);

    /**
     * 엔티티 식별자.
     *
     * @return 식별자 (non-null)
     */
    EntityId id();

    /**
     * 목록 내 위치 안정성을 위한 명시적 순서 값.
     *
     * @return order 값
     */
    int order();
}
