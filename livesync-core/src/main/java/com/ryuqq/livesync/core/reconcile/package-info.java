/**
 * 스냅샷 병합 패키지.
 *
 * <p>{@link com.ryuqq.livesync.core.reconcile.SnapshotReconciler}는 I/O와 로깅이 없는 순수 함수로,
 * 어댑터 계층에서 구독 키별 직렬 레인 위에서 호출됩니다.</p>
 *
 * @author LiveSync Team
 * @since 1.0.0
 */
package com.ryuqq.livesync.core.reconcile;
