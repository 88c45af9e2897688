/**
 * 동기화 컬렉션 계약 패키지.
 *
 * @author LiveSync Team
 * @since 1.0.0
 */
package com.ryuqq.livesync.application.collection;
