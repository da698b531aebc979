package io.entryrender.cli.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Loads {@link RenderConfig} from a YAML file with an environment variable overlay.
 *
 * <pre>
 * render:
 *   profile: profiles/default.yaml
 *   asset-base-path: /static/images/
 *   language: en
 * logging:
 *   format: text     # text | json
 *   level: INFO
 * </pre>
 *
 * <p>
 * Every key can be overridden by an environment variable, which takes precedence over the YAML
 * value. A variable counts as set only if it is defined and non-blank after trimming.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /** Config file read from the working directory when {@code --config} is absent. */
    public static final String DEFAULT_CONFIG_FILE = "entry-render.yaml";

    static final String ENV_PROFILE = "ENTRY_RENDER_PROFILE";
    static final String ENV_ASSET_BASE = "ENTRY_RENDER_ASSET_BASE";
    static final String ENV_LANGUAGE = "ENTRY_RENDER_LANGUAGE";
    static final String ENV_LOG_FORMAT = "ENTRY_RENDER_LOG_FORMAT";
    static final String ENV_LOG_LEVEL = "ENTRY_RENDER_LOG_LEVEL";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads the config file, applying overrides from the supplied lookup. The lookup returns
     * {@code null} for undefined variables.
     *
     * @throws ConfigLoadException if the file is missing, is not valid YAML, or the resulting
     *                             config is incomplete
     */
    public static RenderConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            return mapToConfig(root != null ? root : MissingNode.getInstance(), envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        } catch (Exception e) {
            throw new ConfigLoadException("Failed to load configuration from " + configPath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Builds a config from environment variables alone, for runs without a config file.
     *
     * @throws ConfigLoadException if the environment does not name a profile
     */
    public static RenderConfig fromEnvironment(Function<String, String> envLookup) {
        try {
            return mapToConfig(MissingNode.getInstance(), envLookup);
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Incomplete configuration: " + e.getMessage(), e);
        }
    }

    private static RenderConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        RenderConfig.Builder builder = RenderConfig.builder();

        JsonNode render = root.path("render");
        if (render.has("profile")) builder.profilePath(render.get("profile").asText());
        if (render.has("asset-base-path"))
            builder.assetBasePath(render.get("asset-base-path").asText());
        if (render.has("language")) builder.language(render.get("language").asText());

        JsonNode logging = root.path("logging");
        builder.loggingFormat(textOrDefault(logging, "format", "text"));
        builder.loggingLevel(textOrDefault(logging, "level", "INFO"));

        envString(envLookup, ENV_PROFILE, builder::profilePath);
        envString(envLookup, ENV_ASSET_BASE, builder::assetBasePath);
        envString(envLookup, ENV_LANGUAGE, builder::language);
        envString(envLookup, ENV_LOG_FORMAT, builder::loggingFormat);
        envString(envLookup, ENV_LOG_LEVEL, builder::loggingLevel);

        return builder.build();
    }

    // --- Env var helpers ---

    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    // --- YAML helpers ---

    private static String textOrDefault(JsonNode node, String field, String defaultValue) {
        return node.has(field) ? node.get(field).asText() : defaultValue;
    }
}
