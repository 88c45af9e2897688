package com.ryuqq.livesync.core.model;

/**
 * 동기화 대상 엔티티의 식별자.
 *
 * <p>원격 문서 저장소가 생성 시점에 부여하는 문서 ID를 감쌉니다.
 * 낙관적 생성(optimistic create)에서는 클라이언트가 미리 발급한 ID가 사용될 수 있습니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~1500자</li>
 *   <li>경로 구분자(/) 포함 불가</li>
 * </ul>
 *
 * <p>정렬 시 동일한 order 값의 tie-break 기준으로 {@link #compareTo(EntityId)}가 사용됩니다.</p>
 *
 * @author LiveSync Team
 * @since 1.0.0
 */
public final class EntityId implements Comparable<EntityId> {

    private static final int MAX_LENGTH = 1500;

    private final String value;

    private EntityId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("EntityId cannot be null or blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("EntityId length cannot exceed " + MAX_LENGTH + " characters");
        }
        if (value.indexOf('/') >= 0) {
            throw new IllegalArgumentException("EntityId cannot contain '/': " + value);
        }
        this.value = value;
    }

    /**
     * EntityId 생성.
     *
     * @param value 문서 ID
     * @return EntityId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static EntityId of(String value) {
        return new EntityId(value);
    }

    /**
     * EntityId 값 조회.
     *
     * @return 문서 ID 문자열
     */
    public String getValue() {
        return value;
    }

    @Override
    public int compareTo(EntityId other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EntityId entityId = (EntityId) o;
        return value.equals(entityId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "EntityId{" + value + '}';
    }
}
