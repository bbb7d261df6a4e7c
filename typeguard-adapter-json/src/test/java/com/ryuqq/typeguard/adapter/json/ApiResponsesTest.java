package com.ryuqq.typeguard.adapter.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.typeguard.application.query.Page;
import com.ryuqq.typeguard.core.model.ContactInfo;
import com.ryuqq.typeguard.core.model.User;
import com.ryuqq.typeguard.core.result.BusinessError;
import com.ryuqq.typeguard.core.result.ErrorCodes;
import com.ryuqq.typeguard.core.result.NetworkError;
import com.ryuqq.typeguard.core.result.Result;
import com.ryuqq.typeguard.core.result.ValidationError;
import com.ryuqq.typeguard.core.shape.FieldError;
import com.ryuqq.typeguard.core.shape.ValidationResult;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * ApiResponses tests.
 *
 * @author TypeGuard Team
 * @since 1.0.0
 */
class ApiResponsesTest {

    private static final Instant CREATED = Instant.parse("2024-01-01T00:00:00Z");

    private final ObjectMapper mapper = JsonSupport.objectMapper();
    private final ApiResponses responses = new ApiResponses(mapper);

    @Test
    void toJson_UserSuccess_WritesDocumentWithIsoDates() throws Exception {
        // When
        JsonNode json = mapper.readTree(responses.toJson(Result.success(ann())));

        // Then
        assertThat(json.get("success").asBoolean()).isTrue();
        assertThat(json.get("data").get("name").asText()).isEqualTo("Ann");
        assertThat(json.get("data").get("isActive").asBoolean()).isTrue();
        assertThat(json.get("data").get("createdAt").asText()).isEqualTo("2024-01-01T00:00:00Z");
        assertThat(json.has("error")).isFalse();
        assertThat(json.has("pagination")).isFalse();
    }

    @Test
    void toJson_Page_WritesItemsAndPagination() throws Exception {
        // Given
        Page<User> page = Page.slice(List.of(ann()), 1, 10);

        // When
        JsonNode json = mapper.readTree(responses.toJson(Result.success(page, Map.of("excluded", 0))));

        // Then
        assertThat(json.get("data").isArray()).isTrue();
        assertThat(json.get("data").get(0).get("id").asText()).isEqualTo("user_1");
        assertThat(json.get("pagination").get("total").asInt()).isEqualTo(1);
        assertThat(json.get("pagination").get("pages").asInt()).isEqualTo(1);
        assertThat(json.get("metadata").get("excluded").asInt()).isZero();
    }

    @Test
    void toJson_ValidationFailure_CarriesOnlyValidationFields() throws Exception {
        // Given
        FieldError nested = FieldError.of("email", "email must be a valid email address", "nope");
        FieldError contact = new FieldError("contact", "contact must be a valid contact info record",
            Map.of("email", "nope"), List.of(nested));
        Result<User> failure = Result.failure(
            ValidationError.of("userData", "Invalid user data", ErrorCodes.INVALID_USER_DATA),
            Map.of(ValidationResult.ERRORS_KEY, List.of(contact)));

        // When
        JsonNode json = mapper.readTree(responses.toJson(failure));

        // Then
        JsonNode error = json.get("error");
        assertThat(json.get("success").asBoolean()).isFalse();
        assertThat(json.has("data")).isFalse();
        assertThat(error.get("type").asText()).isEqualTo("validation");
        assertThat(error.get("field").asText()).isEqualTo("userData");
        assertThat(error.get("code").asText()).isEqualTo(ErrorCodes.INVALID_USER_DATA);
        assertThat(error.has("status")).isFalse();
        assertThat(error.has("details")).isFalse();

        JsonNode first = json.get("context").get(ValidationResult.ERRORS_KEY).get(0);
        assertThat(first.get("field").asText()).isEqualTo("contact");
        assertThat(first.get("details").get(0).get("field").asText()).isEqualTo("email");
    }

    @Test
    void render_NetworkAndBusinessErrors_UseOwnFields() {
        ApiError network = responses.render(Result.failure(NetworkError.of(503, "down", "/users"))).error();
        ApiError business = responses.render(Result.failure(BusinessError.of(ErrorCodes.NOT_FOUND, "missing"))).error();

        assertThat(network.type()).isEqualTo("network");
        assertThat(network.status()).isEqualTo(503);
        assertThat(network.endpoint()).isEqualTo("/users");
        assertThat(network.code()).isNull();

        assertThat(business.type()).isEqualTo("business");
        assertThat(business.code()).isEqualTo(ErrorCodes.NOT_FOUND);
        assertThat(business.field()).isNull();
        assertThat(business.status()).isNull();
    }

    private static User ann() {
        return new User("user_1", "Ann", ContactInfo.of("a@b.com"), 30, true, List.of("x"), null, CREATED, CREATED);
    }
}
