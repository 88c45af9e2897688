package com.ryuqq.livesync.core.model;

/**
 * 구독(change feed)의 정규화된 쿼리 시그니처.
 *
 * <p>컬렉션 경로 + 필터 + 정렬 조건으로 구성되며, 동일한 논리 쿼리는 항상 동일한 키를 가집니다.
 * SubscriptionRegistry는 이 키로 중복 구독을 판별합니다.</p>
 *
 * <p>일반적으로 {@link QueryDescriptor#toKey()}를 통해 생성합니다.</p>
 *
 * @author LiveSync Team
 * @since 1.0.0
 */
public final class SubscriptionKey {

    private final String value;

    private SubscriptionKey(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("SubscriptionKey cannot be null or blank");
        }
        this.value = value;
    }

    /**
     * SubscriptionKey 생성.
     *
     * @param value 정규화된 쿼리 시그니처
     * @return SubscriptionKey 인스턴스
     * @throws IllegalArgumentException null 또는 빈 문자열인 경우
     */
    public static SubscriptionKey of(String value) {
        return new SubscriptionKey(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SubscriptionKey that = (SubscriptionKey) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "SubscriptionKey{" + value + '}';
    }
}
