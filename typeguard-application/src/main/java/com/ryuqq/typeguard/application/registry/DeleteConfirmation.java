package com.ryuqq.typeguard.application.registry;

/**
 * 삭제 확인 응답.
 *
 * @author TypeGuard Team
 * @since 1.0.0
 * @param userId 삭제된 사용자 ID
 * @param message 확인 메시지
 */
public record DeleteConfirmation(String userId, String message) {

    public DeleteConfirmation {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId cannot be null or blank");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }

    public static DeleteConfirmation of(String userId) {
        return new DeleteConfirmation(userId, "User " + userId + " deleted successfully");
    }
}
