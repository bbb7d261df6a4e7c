/**
 * 예외를 결과로 변환하는 최상위 경계.
 *
 * @since 1.0.0
 */
package com.ryuqq.typeguard.application.boundary;
