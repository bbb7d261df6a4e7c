/**
 * 목록 조회 조건과 페이지 결과.
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.typeguard.application.query.ListQuery} - 원시 조회 조건 해석 및 범위 검증</li>
 *   <li>{@link com.ryuqq.typeguard.application.query.SortField} - 정렬 필드별 비교자</li>
 *   <li>{@link com.ryuqq.typeguard.application.query.Page} - 페이지 슬라이스</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.ryuqq.typeguard.application.query;
