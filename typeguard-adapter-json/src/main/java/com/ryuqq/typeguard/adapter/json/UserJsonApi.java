package com.ryuqq.typeguard.adapter.json;

import com.ryuqq.typeguard.application.boundary.Boundary;
import com.ryuqq.typeguard.application.registry.UserRegistry;
import com.ryuqq.typeguard.core.result.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.function.Supplier;

/**
 * JSON-in, JSON-out facade over a {@link UserRegistry}.
 *
 * <p>A transport (HTTP handler, CLI) passes request text and path/query values; this class parses
 * bodies with {@link JsonInput}, calls the registry, and renders the outcome with
 * {@link ApiResponses} and {@link HttpStatusPolicy}.</p>
 *
 * <p><strong>Routes it backs:</strong></p>
 * <pre>
 * POST   /users            → createUser(body)       201
 * GET    /users/{id}       → getUser(id)            200
 * GET    /users?page=..    → listUsers(query)       200
 * PUT    /users/{id}       → updateUser(id, body)   200
 * DELETE /users/{id}       → deleteUser(id)         200
 * GET    /events?type=..   → listEvents(type)       200
 * POST   /logins           → recordLogin(body)      201
 * </pre>
 *
 * @author TypeGuard Team
 * @since 1.0.0
 */
public final class UserJsonApi {

    private static final Logger log = LoggerFactory.getLogger(UserJsonApi.class);

    private final UserRegistry registry;
    private final JsonInput input;
    private final ApiResponses responses;

    public UserJsonApi(UserRegistry registry) {
        this(registry, new JsonInput(), new ApiResponses());
    }

    public UserJsonApi(UserRegistry registry, JsonInput input, ApiResponses responses) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (input == null) {
            throw new IllegalArgumentException("input cannot be null");
        }
        if (responses == null) {
            throw new IllegalArgumentException("responses cannot be null");
        }
        this.registry = registry;
        this.input = input;
        this.responses = responses;
    }

    public JsonReply createUser(String body) {
        return reply("createUser", HttpStatusPolicy.CREATED, () -> input.parse(body).flatMap(registry::create));
    }

    public JsonReply getUser(String id) {
        return reply("getUser", HttpStatusPolicy.OK, () -> registry.getById(id));
    }

    /**
     * Lists users from query-string values (numbers may arrive as strings).
     *
     * @param query page, limit, sortBy, sortOrder (any may be absent)
     * @return reply with {@code data} and {@code pagination}
     */
    public JsonReply listUsers(Map<String, String> query) {
        return reply("listUsers", HttpStatusPolicy.OK, () -> registry.list(query));
    }

    public JsonReply updateUser(String id, String body) {
        return reply("updateUser", HttpStatusPolicy.OK,
            () -> input.parse(body).flatMap(partial -> registry.update(id, partial)));
    }

    public JsonReply deleteUser(String id) {
        return reply("deleteUser", HttpStatusPolicy.OK, () -> registry.delete(id));
    }

    public JsonReply listEvents(String type) {
        return reply("listEvents", HttpStatusPolicy.OK, () -> registry.listEventsByType(type));
    }

    public JsonReply recordLogin(String body) {
        return reply("recordLogin", HttpStatusPolicy.CREATED,
            () -> input.parse(body).flatMap(registry::recordLoginAttempt));
    }

    private <T> JsonReply reply(String operation, int successStatus, Supplier<Result<T>> action) {
        Result<T> result = Boundary.guard(operation, action);
        int status = HttpStatusPolicy.statusOf(result, successStatus);
        if (status >= HttpStatusPolicy.INTERNAL_SERVER_ERROR) {
            log.warn("{} failed with status {}", operation, status);
        }
        return new JsonReply(status, responses.toJson(result));
    }
}
