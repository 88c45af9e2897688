/**
 * 동기화 도메인 모델 패키지.
 *
 * <p>구독 식별(SubscriptionKey, QueryDescriptor), 구독 분류/우선순위,
 * 동기화 엔티티 계약(SyncEntity)과 원격 문서 표현(RemoteDocument)을 정의합니다.</p>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>불변 값 객체:</strong> 모든 타입은 생성 후 변경 불가</li>
 *   <li><strong>닫힌 분류:</strong> 구독 분류는 문자열이 아닌 enum과 기본 우선순위 테이블로 표현</li>
 *   <li><strong>정규화:</strong> 동일한 논리 쿼리는 동일한 SubscriptionKey로 수렴</li>
 * </ul>
 *
 * @author LiveSync Team
 * @since 1.0.0
 */
package com.ryuqq.livesync.core.model;
