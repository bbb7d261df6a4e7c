package com.ryuqq.typeguard.testkit.fixture;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Raw (untyped) input builders for registry tests.
 *
 * <p>Every builder returns a fresh mutable map so tests can add, replace or remove keys.</p>
 *
 * @author TypeGuard Team
 * @since 1.0.0
 */
public final class UserFixtures {

    private UserFixtures() {
    }

    /**
     * {@code {name:"Ann", contact:{email:"a@b.com"}, age:30, isActive:true, tags:["x"]}}.
     *
     * @return mutable raw input
     */
    public static Map<String, Object> ann() {
        return user("Ann", "a@b.com", 30);
    }

    public static Map<String, Object> user(String name, String email, int age) {
        Map<String, Object> contact = new LinkedHashMap<>();
        contact.put("email", email);

        Map<String, Object> input = new LinkedHashMap<>();
        input.put("name", name);
        input.put("contact", contact);
        input.put("age", age);
        input.put("isActive", true);
        input.put("tags", List.of("x"));
        return input;
    }

    /**
     * Input with every optional field populated (phone, address, metadata).
     *
     * @return mutable raw input
     */
    public static Map<String, Object> fullUser() {
        Map<String, Object> address = new LinkedHashMap<>();
        address.put("street", "1 Main St");
        address.put("city", "Springfield");
        address.put("state", "IL");
        address.put("zipCode", "62701");
        address.put("country", "US");

        Map<String, Object> contact = new LinkedHashMap<>();
        contact.put("email", "full@example.com");
        contact.put("phone", "+1 (555) 123-4567");
        contact.put("address", address);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("plan", "pro");
        metadata.put("referrals", List.of("a", "b"));

        Map<String, Object> input = user("Full", "full@example.com", 42);
        input.put("contact", contact);
        input.put("tags", List.of("admin", "beta", "admin"));
        input.put("metadata", metadata);
        return input;
    }

    public static Map<String, Object> loginAttempt(String userId, boolean successful) {
        Map<String, Object> attempt = new LinkedHashMap<>();
        attempt.put("userId", userId);
        attempt.put("ip", "192.168.0.10");
        attempt.put("userAgent", "Mozilla/5.0");
        attempt.put("successful", successful);
        if (!successful) {
            attempt.put("failureReason", "invalid password");
        }
        return attempt;
    }

    /**
     * Deterministic id generator: {@code user_} followed by a 32-digit zero-padded hex counter.
     *
     * @return new generator starting at 1
     */
    public static Supplier<String> sequentialIds() {
        AtomicLong counter = new AtomicLong();
        return () -> String.format("user_%032x", counter.incrementAndGet());
    }
}
