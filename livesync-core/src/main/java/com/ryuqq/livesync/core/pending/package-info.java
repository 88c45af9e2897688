/**
 * 낙관적 쓰기 추적 모델 패키지.
 *
 * <p>로컬 쓰기가 원격 저장소에 반영되기 전, 오래된 스냅샷이 로컬 상태를 덮어쓰거나
 * 삭제된 문서를 되살리는 구간을 억제하기 위한 항목을 정의합니다.</p>
 *
 * @author LiveSync Team
 * @since 1.0.0
 */
package com.ryuqq.livesync.core.pending;
