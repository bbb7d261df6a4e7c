package com.ryuqq.typeguard.adapter.json;

/**
 * Status code and JSON body returned by {@link UserJsonApi}.
 *
 * @param status HTTP status code
 * @param body JSON envelope
 * @author TypeGuard Team
 * @since 1.0.0
 */
public record JsonReply(int status, String body) {

    public JsonReply {
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }
    }
}
