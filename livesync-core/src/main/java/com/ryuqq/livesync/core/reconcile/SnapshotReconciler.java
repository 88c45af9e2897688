package com.ryuqq.livesync.core.reconcile;

import com.ryuqq.livesync.core.model.EntityId;
import com.ryuqq.livesync.core.model.RemoteDocument;
import com.ryuqq.livesync.core.model.SubscriptionKey;
import com.ryuqq.livesync.core.model.SyncEntity;
import com.ryuqq.livesync.core.pending.MutationKind;
import com.ryuqq.livesync.core.pending.PendingMutation;
import com.ryuqq.livesync.core.spi.PendingMutationTracker;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 원격 스냅샷과 이전 로컬 목록을 병합하는 순수 로직.
 *
 * <p>같은 입력과 같은 추적기 상태에 대해 항상 같은 결과를 반환하며, 입력 목록을 변경하지 않습니다.
 * 동일 구독 키에 대한 호출은 호출자가 직렬화해야 합니다 (구독 키별 직렬 레인).</p>
 *
 * <p><strong>병합 절차:</strong></p>
 * <ol>
 *   <li>만료 항목 정리 ({@link PendingMutationTracker#sweepExpired()})</li>
 *   <li>hasPendingWrites 문서와 활성 DELETE 항목이 있는 문서 제외</li>
 *   <li>남은 원격 문서를 수신 순서대로 ID 맵에 적재</li>
 *   <li>이전 목록 순회:
 *     <ul>
 *       <li>맵에 있고 활성 CREATE/UPDATE 항목 존재 → 로컬 유지</li>
 *       <li>맵에 있고 활성 항목 없음 → 원격으로 교체</li>
 *       <li>맵에 없음 → 로컬 유지 (원격 삭제는 이후 스냅샷이 반영)</li>
 *     </ul>
 *   </li>
 *   <li>맵에 남은 원격 문서를 수신 순서대로 추가</li>
 *   <li>재정렬 플래그가 활성이면 병합 순서 유지, 아니면 order → id 오름차순 정렬</li>
 * </ol>
 *
 * <p><strong>빈 스냅샷:</strong> 원격이 비어 있고 이전 목록이 비어 있지 않으면,
 * 이전 목록 중 하나라도 활성 항목이 있는 경우 이전 목록을 그대로 반환하고 그렇지 않으면 빈 목록을 반환합니다.
 * 생성 직후 문서가 인덱싱되기 전의 빈 스냅샷이 방금 만든 항목을 지우는 것을 막습니다.</p>
 *
 * @author LiveSync Team
 * @since 1.0.0
 */
public final class SnapshotReconciler {

    private final PendingMutationTracker tracker;

    public SnapshotReconciler(PendingMutationTracker tracker) {
        if (tracker == null) {
            throw new IllegalArgumentException("tracker cannot be null");
        }
        this.tracker = tracker;
    }

    /**
     * 원격 스냅샷을 이전 목록에 병합.
     *
     * @param scope 재정렬 플래그 조회용 구독 키
     * @param previous 직전 병합 결과 (비어 있을 수 있음)
     * @param remoteDocs 원격 스냅샷 (수신 순서)
     * @param <T> 엔티티 타입
     * @return 병합 결과
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public <T extends SyncEntity> ReconciledList<T> reconcile(
        SubscriptionKey scope,
        List<T> previous,
        List<RemoteDocument<T>> remoteDocs
    ) {
        if (scope == null) {
            throw new IllegalArgumentException("scope cannot be null");
        }
        if (previous == null) {
            throw new IllegalArgumentException("previous cannot be null");
        }
        if (remoteDocs == null) {
            throw new IllegalArgumentException("remoteDocs cannot be null");
        }

        tracker.sweepExpired();

        if (remoteDocs.isEmpty() && !previous.isEmpty()) {
            for (T entity : previous) {
                if (tracker.isActive(entity.id())) {
                    return ReconciledList.held(previous);
                }
            }
            return ReconciledList.cleared();
        }

        int suppressed = 0;
        Map<EntityId, T> remoteMap = new LinkedHashMap<>();
        for (RemoteDocument<T> doc : remoteDocs) {
            if (doc.hasPendingWrites() || tracker.isActive(doc.id(), MutationKind.DELETE)) {
                suppressed++;
                continue;
            }
            remoteMap.put(doc.id(), doc.entity());
        }

        List<T> merged = new ArrayList<>(previous.size() + remoteMap.size());
        Set<EntityId> seen = new HashSet<>();
        int keptLocal = 0;
        int takenRemote = 0;
        int retained = 0;

        for (T local : previous) {
            EntityId id = local.id();
            if (!seen.add(id)) {
                continue;
            }
            T remote = remoteMap.remove(id);
            if (remote == null) {
                merged.add(local);
                retained++;
                continue;
            }
            Optional<PendingMutation> pending = tracker.activeMutation(id);
            if (pending.isPresent() && pending.get().kind().isLocallyAuthoritative()) {
                merged.add(local);
                keptLocal++;
            } else {
                merged.add(remote);
                takenRemote++;
            }
        }

        int appended = 0;
        for (T remote : remoteMap.values()) {
            if (seen.add(remote.id())) {
                merged.add(remote);
                appended++;
            }
        }

        boolean orderPreserved = tracker.isReorderActive(scope);
        if (!orderPreserved) {
            merged.sort(SyncEntity.ORDERING);
        }

        return new ReconciledList<>(merged, keptLocal, takenRemote, retained, appended, suppressed,
            orderPreserved, false);
    }
}
