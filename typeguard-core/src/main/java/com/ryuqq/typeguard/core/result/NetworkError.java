package com.ryuqq.typeguard.core.result;

/**
 * 외부 호출 오류.
 *
 * @param status 응답 상태 코드 (연결 실패 등 응답이 없으면 0)
 * @param message 오류 메시지
 * @param endpoint 호출 대상
 *
 * @author TypeGuard Team
 * @since 1.0.0
 */
public record NetworkError(
    int status,
    String message,
    String endpoint
) implements AppError {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public NetworkError {
        if (status < 0) {
            throw new IllegalArgumentException("status must be non-negative (current: " + status + ")");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalArgumentException("endpoint cannot be null or blank");
        }
    }

    public static NetworkError of(int status, String message, String endpoint) {
        return new NetworkError(status, message, endpoint);
    }

    @Override
    public ErrorType type() {
        return ErrorType.NETWORK;
    }
}
