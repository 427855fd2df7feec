package io.fluenthttp.core;

import io.fluenthttp.core.error.FormDecodeException;
import io.fluenthttp.core.model.FormValues;
import io.fluenthttp.core.model.MediaType;
import io.fluenthttp.core.model.Request;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Set;

/**
 * Url-encoded form decoding for any HTTP method.
 *
 * <p>
 * Conventional form parsing only looks at bodies of POST, PUT and PATCH
 * requests, and only when they declare the form content type. Test servers and
 * matchers also need to inspect forms sent with other methods (a DELETE with a
 * form body, for instance); {@link #parsePostForm(Request)} covers both.
 */
public final class Forms {

    private static final Set<String> FORM_METHODS = Set.of("POST", "PUT", "PATCH");

    private Forms() {
        // utility class
    }

    /**
     * Populates {@link Request#form()} from the request body. Idempotent: a
     * request whose form is already populated is left untouched.
     *
     * <ul>
     * <li>POST, PUT, PATCH: the body is parsed only if the content type is
     * {@code application/x-www-form-urlencoded}; otherwise the form is empty.</li>
     * <li>Any other method: the whole body is read and parsed.</li>
     * </ul>
     * The body is buffered, so it remains readable afterwards.
     *
     * @throws FormDecodeException if the body cannot be read or is not valid
     *                             url-encoded data
     */
    public static void parsePostForm(Request request) {
        if (request.form() != null) {
            return;
        }

        if (FORM_METHODS.contains(request.method())
                && !MediaType.FORM.matches(request.headers().first("content-type"))) {
            request.form(FormValues.empty());
            return;
        }

        byte[] body;
        try {
            body = request.bufferBody();
        } catch (IOException e) {
            throw new FormDecodeException("unable to read body: " + e.getMessage(), e);
        }

        try {
            request.form(FormValues.parse(new String(body, StandardCharsets.UTF_8)));
        } catch (IllegalArgumentException e) {
            throw new FormDecodeException("unable to parse form values from body: " + e.getMessage(), e);
        }
    }
}
