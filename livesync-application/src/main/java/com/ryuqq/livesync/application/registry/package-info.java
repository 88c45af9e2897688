/**
 * 구독 레지스트리 계약 패키지.
 *
 * <p>소비자는 {@link com.ryuqq.livesync.application.registry.SubscriptionRegistry}를 통해서만
 * 원격 피드를 열고 닫으며, 피드 자체 대신 핸들/키를 보관합니다.</p>
 *
 * @author LiveSync Team
 * @since 1.0.0
 */
package com.ryuqq.livesync.application.registry;
