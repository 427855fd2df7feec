package io.fluenthttp.example;

import io.fluenthttp.core.Api;
import io.fluenthttp.core.config.ApiConfig;
import io.fluenthttp.core.spi.Doer;
import io.fluenthttp.example.ApiPayloads.CreateUserRequest;
import io.fluenthttp.example.ApiPayloads.CreateUserResponse;
import io.fluenthttp.example.ApiPayloads.GetUserByIdResponse;
import java.net.URI;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Client of a user management API, built on {@link Api}.
 *
 * <p>
 * Every call shares these response defaults:
 * <ul>
 * <li>200: success;</li>
 * <li>401: {@link UnauthorizedException};</li>
 * <li>404: {@link UserNotFoundException}.</li>
 * </ul>
 * A 200 answer whose JSON body is {@code null} fails with
 * {@link EmptyResponseException}.
 * Any other status fails with
 * {@link io.fluenthttp.core.error.UnhandledStatusException}.
 *
 * <p>
 * Thread-safe: each call creates its own request builder.
 */
public final class UserClient {

    private final Api api;

    /**
     * @param doer          executor for the API calls
     * @param serverAddress base URL of the user API
     */
    public UserClient(Doer doer, URI serverAddress) {
        this(new Api(doer, serverAddress));
    }

    private UserClient(Api api) {
        this.api = api
                .withResponseHandler(401, response -> {
                    throw new UnauthorizedException();
                })
                .withResponseHandler(404, response -> {
                    throw new UserNotFoundException();
                })
                .withResponseHandler(200, response -> {});
    }

    /** Creates a client whose executor, base URL and defaults come from configuration. */
    public static UserClient fromConfig(ApiConfig config) {
        return new UserClient(Api.fromConfig(config));
    }

    /** Creates a user and returns the identifier the API assigned to it. */
    public UserId createUser(String userName) {
        AtomicReference<CreateUserResponse> created = new AtomicReference<>();
        api.execute(api.post("/users").sendJson(new CreateUserRequest(userName)))
                .receiveJson(200, CreateUserResponse.class, created::set)
                .resolve();
        if (created.get() == null) {
            throw new EmptyResponseException("create user");
        }
        return new UserId(created.get().userId());
    }

    /** Fetches one user. */
    public User getUserById(UserId userId) {
        AtomicReference<GetUserByIdResponse> found = new AtomicReference<>();
        api.execute(api.get("/users/{userID}").pathReplacer("{userID}", userId.toString()))
                .receiveJson(200, GetUserByIdResponse.class, found::set)
                .resolve();
        if (found.get() == null) {
            throw new EmptyResponseException("get user");
        }
        return found.get().toModel();
    }

    /** Deletes one user; only the default handlers apply. */
    public void deleteUserById(UserId userId) {
        api.executeAndResolve(api.delete("/users/{userID}").pathReplacer("{userID}", userId.toString()));
    }
}
