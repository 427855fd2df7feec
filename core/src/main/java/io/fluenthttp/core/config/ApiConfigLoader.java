package io.fluenthttp.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * Loads {@link ApiConfig} from a YAML file with an optional environment
 * variable overlay.
 *
 * <p>
 * Layout:
 * <pre>{@code
 * api:
 *   base-url: https://api.example.com/v1
 *   body-size-read-limit: 65536
 *   headers:
 *     accept: application/json
 *     x-trace: [a, b]
 * client:
 *   connect-timeout-ms: 10000
 *   read-timeout-ms: 30000
 *   follow-redirects: false
 * }</pre>
 * Missing keys receive the documented defaults from {@link ApiConfig.Builder}.
 *
 * <p>
 * Environment overlay: {@code FLUENTHTTP_BASE_URL},
 * {@code FLUENTHTTP_BODY_SIZE_READ_LIMIT}, {@code FLUENTHTTP_CONNECT_TIMEOUT_MS},
 * {@code FLUENTHTTP_READ_TIMEOUT_MS}, {@code FLUENTHTTP_FOLLOW_REDIRECTS}. An env
 * var is considered "set" if and only if it is defined AND its trimmed value is
 * non-empty; otherwise the YAML value stands.
 */
public final class ApiConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final String ENV_PREFIX = "FLUENTHTTP_";

    private ApiConfigLoader() {
        // utility class
    }

    /**
     * Loads configuration from a YAML file, applying overrides from
     * {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing or invalid
     */
    public static ApiConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads configuration from a YAML file, applying overrides from the supplied
     * lookup function ({@code null} result = undefined).
     *
     * @throws ConfigLoadException if the file is missing or invalid
     */
    public static ApiConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath);
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            return fromTree(YAML_MAPPER.readTree(in), envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        } catch (RuntimeException e) {
            throw new ConfigLoadException("Failed to load configuration from: " + configPath, e);
        }
    }

    /** Builds configuration from environment variables only. */
    public static ApiConfig fromEnvironment(Function<String, String> envLookup) {
        return fromTree(null, envLookup);
    }

    private static ApiConfig fromTree(JsonNode root, Function<String, String> envLookup) {
        ApiConfig.Builder builder = ApiConfig.builder();

        if (root != null && !root.isMissingNode() && !root.isNull()) {
            JsonNode api = root.path("api");
            if (api.has("base-url")) builder.baseUrl(api.get("base-url").asText());
            if (api.has("body-size-read-limit")) builder.bodySizeReadLimit(requireNumber(api, "body-size-read-limit"));
            JsonNode headers = api.path("headers");
            Iterator<Map.Entry<String, JsonNode>> fields = headers.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> header = fields.next();
                builder.defaultHeader(header.getKey(), textValues(header.getValue()));
            }

            JsonNode client = root.path("client");
            if (client.has("connect-timeout-ms")) builder.connectTimeoutMs(requireInt(client, "connect-timeout-ms"));
            if (client.has("read-timeout-ms")) builder.readTimeoutMs(requireInt(client, "read-timeout-ms"));
            if (client.has("follow-redirects"))
                builder.followRedirects(client.get("follow-redirects").asBoolean());
        }

        envString(envLookup, "BASE_URL", builder::baseUrl);
        envLong(envLookup, "BODY_SIZE_READ_LIMIT", builder::bodySizeReadLimit);
        envInt(envLookup, "CONNECT_TIMEOUT_MS", builder::connectTimeoutMs);
        envInt(envLookup, "READ_TIMEOUT_MS", builder::readTimeoutMs);
        envBool(envLookup, "FOLLOW_REDIRECTS", builder::followRedirects);

        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid configuration: " + e.getMessage(), e);
        }
    }

    // --- Env helpers ---

    private static boolean isSet(Function<String, String> envLookup, String name) {
        String value = envLookup.apply(ENV_PREFIX + name);
        return value != null && !value.trim().isEmpty();
    }

    private static String env(Function<String, String> envLookup, String name) {
        return envLookup.apply(ENV_PREFIX + name).trim();
    }

    private static void envString(Function<String, String> envLookup, String name, Consumer<String> setter) {
        if (isSet(envLookup, name)) {
            setter.accept(env(envLookup, name));
        }
    }

    private static void envInt(Function<String, String> envLookup, String name, IntConsumer setter) {
        if (isSet(envLookup, name)) {
            try {
                setter.accept(Integer.parseInt(env(envLookup, name)));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(ENV_PREFIX + name + " must be an integer", e);
            }
        }
    }

    private static void envLong(Function<String, String> envLookup, String name, LongConsumer setter) {
        if (isSet(envLookup, name)) {
            try {
                setter.accept(Long.parseLong(env(envLookup, name)));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(ENV_PREFIX + name + " must be an integer", e);
            }
        }
    }

    private static void envBool(Function<String, String> envLookup, String name, Consumer<Boolean> setter) {
        if (isSet(envLookup, name)) {
            setter.accept(Boolean.parseBoolean(env(envLookup, name)));
        }
    }

    // --- YAML helpers ---

    private static long requireNumber(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (!value.isIntegralNumber()) {
            throw new ConfigLoadException("'" + field + "' must be an integer, got: " + value);
        }
        if (!value.canConvertToLong()) {
            throw new ConfigLoadException("'" + field + "' is out of range, got: " + value);
        }
        return value.asLong();
    }

    private static int requireInt(JsonNode node, String field) {
        long value = requireNumber(node, field);
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new ConfigLoadException("'" + field + "' is out of range, got: " + value);
        }
        return (int) value;
    }

    private static List<String> textValues(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(item -> values.add(item.asText()));
        } else {
            values.add(node.asText());
        }
        return values;
    }
}
