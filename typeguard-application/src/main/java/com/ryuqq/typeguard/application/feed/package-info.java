/**
 * 세션 단위 감사 이벤트 피드.
 *
 * @since 1.0.0
 */
package com.ryuqq.typeguard.application.feed;
