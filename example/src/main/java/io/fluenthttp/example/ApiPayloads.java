package io.fluenthttp.example;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Wire formats of the user API. */
final class ApiPayloads {

    private ApiPayloads() {
        // utility class
    }

    /** {@code POST /users} request body. */
    record CreateUserRequest(@JsonProperty("user_name") String userName) {}

    /** {@code POST /users} response body. */
    record CreateUserResponse(@JsonProperty("user_id") long userId) {}

    /** {@code GET /users/{userID}} response body. */
    record GetUserByIdResponse(@JsonProperty("id") long id, @JsonProperty("name") String name) {

        User toModel() {
            return new User(new UserId(id), name);
        }
    }
}
