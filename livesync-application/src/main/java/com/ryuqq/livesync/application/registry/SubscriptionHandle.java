package com.ryuqq.livesync.application.registry;

import com.ryuqq.livesync.core.model.SubscriptionKey;
import com.ryuqq.livesync.core.model.SubscriptionKind;
import com.ryuqq.livesync.core.model.SubscriptionPriority;

/**
 * 구독 핸들.
 *
 * <p>호출자는 피드 자체가 아닌 이 핸들(또는 키)만 보관합니다.
 * 피드의 소유권은 항상 {@link SubscriptionRegistry}에 있습니다.</p>
 *
 * <p><strong>세 가지 가능한 상태:</strong></p>
 * <ul>
 *   <li>created: 이번 호출로 새 원격 피드가 열림</li>
 *   <li>reused: 기존 피드에 콜백만 추가됨 (원격 호출 없음)</li>
 *   <li>rejected: 원격 저장소가 구독을 거부함 (콜백에 실패 전달됨)</li>
 * </ul>
 *
 * <p><strong>불변성:</strong> 생성 후 상태 변경 불가</p>
 *
 * @author LiveSync Team
 * @since 1.0.0
 */
public final class SubscriptionHandle {

    /**
     * 핸들 상태.
     */
    public enum Status {
        CREATED,
        REUSED,
        REJECTED
    }

    private final SubscriptionKey key;
    private final SubscriptionKind kind;
    private final SubscriptionPriority priority;
    private final Status status;

    private SubscriptionHandle(SubscriptionKey key, SubscriptionKind kind,
                               SubscriptionPriority priority, Status status) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (priority == null) {
            throw new IllegalArgumentException("priority cannot be null");
        }
        this.key = key;
        this.kind = kind;
        this.priority = priority;
        this.status = status;
    }

    /**
     * 새 피드 핸들 생성.
     */
    public static SubscriptionHandle created(SubscriptionKey key, SubscriptionKind kind, SubscriptionPriority priority) {
        return new SubscriptionHandle(key, kind, priority, Status.CREATED);
    }

    /**
     * 재사용 핸들 생성.
     *
     * <p>kind/priority는 기존 구독의 값입니다.</p>
     */
    public static SubscriptionHandle reused(SubscriptionKey key, SubscriptionKind kind, SubscriptionPriority priority) {
        return new SubscriptionHandle(key, kind, priority, Status.REUSED);
    }

    /**
     * 거부 핸들 생성.
     */
    public static SubscriptionHandle rejected(SubscriptionKey key, SubscriptionKind kind, SubscriptionPriority priority) {
        return new SubscriptionHandle(key, kind, priority, Status.REJECTED);
    }

    public SubscriptionKey getKey() {
        return key;
    }

    public SubscriptionKind getKind() {
        return kind;
    }

    public SubscriptionPriority getPriority() {
        return priority;
    }

    public Status getStatus() {
        return status;
    }

    /**
     * 기존 피드를 재사용했는지 확인.
     *
     * @return REUSED인 경우 true
     */
    public boolean isReused() {
        return status == Status.REUSED;
    }

    /**
     * 구독이 거부되었는지 확인.
     *
     * @return REJECTED인 경우 true
     */
    public boolean isRejected() {
        return status == Status.REJECTED;
    }

    @Override
    public String toString() {
        return "SubscriptionHandle{" +
            "key=" + key.getValue() +
            ", kind=" + kind +
            ", priority=" + priority +
            ", status=" + status +
            '}';
    }
}
