/**
 * 사용자 레지스트리 서비스.
 *
 * <p>검증된 사용자 엔티티의 저장과 감사 로그 기록을 담당합니다.</p>
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.typeguard.application.registry.UserRegistry} - create/getById/list/update/delete/listEvents 계약</li>
 *   <li>{@link com.ryuqq.typeguard.application.registry.DefaultUserRegistry} - SPI 기반 기본 구현체</li>
 *   <li>{@link com.ryuqq.typeguard.application.registry.RegistryConfig} - 보존 건수, 페이지 크기, 감사 주체 설정</li>
 * </ul>
 *
 * <p><strong>저장소 구현체:</strong></p>
 * <p>인메모리 구현체는 typeguard-adapter-inmemory 모듈에서 제공됩니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.typeguard.application.registry;
