package io.entryrender.core.profile;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.entryrender.core.error.ProfileLoadException;
import io.entryrender.core.model.DisplayAspect;
import io.entryrender.core.model.DisplayMode;
import io.entryrender.core.model.DisplayProfile;
import io.entryrender.core.model.RenderRule;
import io.entryrender.core.model.Visibility;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses YAML display profile files into {@link DisplayProfile} instances.
 *
 * <p>
 * Every document is validated against the bundled {@code schemas/display-profile.schema.json}
 * before rules are built. Rules without an {@code order} get {@code (position + 1) * 10}; rules
 * without a {@code class} use the element name.
 *
 * <p>
 * Thread-safe.
 */
public final class DisplayProfileParser {

    private static final Logger LOG = LoggerFactory.getLogger(DisplayProfileParser.class);

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);
    private static final String SCHEMA_RESOURCE = "/schemas/display-profile.schema.json";

    private final JsonSchema schema;

    public DisplayProfileParser() {
        this.schema = loadSchema();
    }

    /**
     * Parses the profile file at the given path.
     *
     * @throws ProfileLoadException if the file cannot be read, is not valid YAML, or violates the
     *                              profile schema
     */
    public DisplayProfile parse(Path path) {
        String source = path.toString();
        try (InputStream in = Files.newInputStream(path)) {
            return parse(in, source);
        } catch (IOException e) {
            throw new ProfileLoadException("Failed to read profile YAML: " + e.getMessage(), e, source);
        }
    }

    /**
     * Parses a profile document from a stream. The stream is not closed.
     *
     * @param source name used in error messages, e.g. a file name or resource path
     */
    public DisplayProfile parse(InputStream in, String source) {
        JsonNode root = readYaml(in, source);
        validate(root, source);

        String id = root.get("profile").asText();
        String name = optionalString(root, "name");
        String description = optionalString(root, "description");

        List<RenderRule> rules = new ArrayList<>();
        JsonNode rulesNode = root.get("rules");
        for (int i = 0; i < rulesNode.size(); i++) {
            rules.add(parseRule(rulesNode.get(i), id, i, source));
        }
        LOG.info("Loaded display profile '{}' with {} rules from {}", id, rules.size(), source);
        return new DisplayProfile(id, name, description, rules);
    }

    // --- Private helpers ---

    private RenderRule parseRule(JsonNode node, String profileId, int index, String source) {
        String element = node.get("element").asText();
        RenderRule.Builder builder = RenderRule.builder(element)
                .order(node.has("order") ? node.get("order").asInt() : (index + 1) * 10)
                .cssClass(node.has("class") ? node.get("class").asText() : element)
                .prefix(optionalString(node, "prefix"))
                .suffix(optionalString(node, "suffix"))
                .filter(optionalString(node, "filter"))
                .separator(optionalString(node, "separator"))
                .forcedLanguage(optionalString(node, "language"));
        try {
            String visibility = optionalString(node, "visibility");
            if (visibility != null) {
                builder.visibility(Visibility.fromConfig(visibility));
            }
            String mode = optionalString(node, "mode");
            if (mode != null) {
                builder.mode(DisplayMode.fromConfig(mode));
            }
            String aspect = optionalString(node, "aspect");
            if (aspect != null) {
                builder.aspect(DisplayAspect.fromConfig(aspect));
            }
        } catch (IllegalArgumentException e) {
            throw new ProfileLoadException(
                    String.format("Profile '%s' rule[%d] (%s): %s", profileId, index, element, e.getMessage()),
                    e,
                    source);
        }
        return builder.build();
    }

    private void validate(JsonNode root, String source) {
        Set<ValidationMessage> errors = schema.validate(root);
        if (!errors.isEmpty()) {
            String detail = errors.stream()
                    .map(ValidationMessage::getMessage)
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new ProfileLoadException("Profile violates display profile schema: " + detail, source);
        }
    }

    private static JsonNode readYaml(InputStream in, String source) {
        try {
            JsonNode root = YAML_MAPPER.readTree(in);
            if (root == null || root.isMissingNode() || root.isNull()) {
                throw new ProfileLoadException("Profile YAML is empty", source);
            }
            return root;
        } catch (IOException e) {
            throw new ProfileLoadException("Failed to parse profile YAML: " + e.getMessage(), e, source);
        }
    }

    private static JsonSchema loadSchema() {
        try (InputStream in = DisplayProfileParser.class.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + SCHEMA_RESOURCE);
            }
            return SCHEMA_FACTORY.getSchema(new ObjectMapper().readTree(in));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load " + SCHEMA_RESOURCE, e);
        }
    }

    private static String optionalString(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && !value.isNull() ? value.asText() : null;
    }
}
