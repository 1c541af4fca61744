package io.docmirror.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.docmirror.core.error.SchemaDefinitionException;
import io.docmirror.core.error.SchemaParseException;
import io.docmirror.core.model.FieldDescriptor;
import io.docmirror.core.model.FieldType;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Parses schema files into ordered {@link FieldDescriptor} lists.
 *
 * <p>
 * Accepts YAML or JSON (JSON is valid YAML). The root is either a list of field definitions
 * or an object with a {@code fields} list:
 *
 * <pre>
 * fields:
 *   - name: title
 *     type: string
 *   - name: address
 *     type: map
 *     fields:
 *       - name: city
 *         type: string
 *   - name: tags
 *     type: string
 *     repeated: true
 * </pre>
 *
 * <p>
 * Every definition is checked twice. First structurally against the bundled
 * {@code schema/field-schema.json} (JSON Schema 2020-12): required keys, value types, no
 * unknown keys. Violations raise {@link SchemaParseException}. Then semantically: unknown type
 * names, {@code fields} on non-map types, maps without {@code fields} and duplicate sibling
 * names raise {@link SchemaDefinitionException}. A schema that parses is therefore safe to run
 * through the engine.
 *
 * <p>
 * Thread-safe: the YAML mapper and the compiled meta-schema are immutable once built.
 */
public final class SchemaParser {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);
    private static final String FIELD_SCHEMA_RESOURCE = "/schema/field-schema.json";

    private final JsonSchema fieldSchema;

    public SchemaParser() {
        this.fieldSchema = loadFieldSchema();
    }

    /**
     * Parses the schema file at the given path.
     *
     * @param path path to a YAML or JSON schema file
     * @return ordered, validated field descriptors
     * @throws SchemaParseException      if the file cannot be read or is structurally invalid
     * @throws SchemaDefinitionException if a definition is semantically invalid
     */
    public List<FieldDescriptor> parse(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        String source = path.toString();
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(path.toFile());
        } catch (IOException e) {
            throw new SchemaParseException("Failed to read or parse schema: " + e.getMessage(), e, source);
        }
        return parse(root, source);
    }

    /**
     * Parses schema text.
     *
     * @param content YAML or JSON schema text
     * @param source  identifier used in error messages
     */
    public List<FieldDescriptor> parse(String content, String source) {
        Objects.requireNonNull(content, "content must not be null");
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(content);
        } catch (IOException e) {
            throw new SchemaParseException("Failed to parse schema: " + e.getMessage(), e, source);
        }
        return parse(root, source);
    }

    /**
     * Parses an already-read schema tree.
     *
     * @param root   list of definitions, or an object with a {@code fields} list
     * @param source identifier used in error messages
     */
    public List<FieldDescriptor> parse(JsonNode root, String source) {
        if (root == null || root.isNull() || root.isMissingNode()) {
            throw new SchemaParseException("Schema is empty", source);
        }
        JsonNode fieldsNode = root;
        if (root.isObject()) {
            rejectUnknownRootKeys(root, source);
            fieldsNode = root.get("fields");
            if (fieldsNode == null) {
                throw new SchemaParseException("Schema object requires a 'fields' list", source);
            }
        }
        if (!fieldsNode.isArray()) {
            throw new SchemaParseException(
                    "Schema must be a list of field definitions or an object with a 'fields' list", source);
        }
        return parseFields(fieldsNode, null, source);
    }

    private List<FieldDescriptor> parseFields(JsonNode fieldsNode, String parentPath, String source) {
        List<FieldDescriptor> descriptors = new ArrayList<>();
        Set<String> names = new HashSet<>();
        int index = 0;
        for (JsonNode definition : fieldsNode) {
            String location = (parentPath == null ? "fields" : parentPath + ".fields") + "[" + index++ + "]";
            FieldDescriptor descriptor = parseField(definition, location, parentPath, source);
            if (!names.add(descriptor.name())) {
                throw new SchemaDefinitionException(
                        "Duplicate field name '" + descriptor.name() + "' at " + location + " in " + source,
                        definition.toString());
            }
            descriptors.add(descriptor);
        }
        return descriptors;
    }

    private FieldDescriptor parseField(JsonNode definition, String location, String parentPath, String source) {
        validateStructure(definition, location, source);

        String name = definition.get("name").asText();
        String type = definition.get("type").asText();
        boolean repeated = definition.path("repeated").asBoolean(false);
        String description = definition.hasNonNull("description")
                ? definition.get("description").asText()
                : null;
        String path = parentPath == null ? name : parentPath + "." + name;

        FieldType fieldType = FieldType.fromName(type)
                .orElseThrow(() -> new SchemaDefinitionException(
                        "Invalid field definition '" + path + "' in " + source + ": unknown type '" + type
                                + "', expected one of " + FieldType.typeNames(),
                        definition.toString()));

        JsonNode fieldsNode = definition.get("fields");
        List<FieldDescriptor> children = List.of();
        if (fieldType == FieldType.MAP) {
            if (fieldsNode == null) {
                throw new SchemaDefinitionException(
                        "Invalid field definition '" + path + "' in " + source + ": map fields require 'fields'",
                        definition.toString());
            }
            children = parseFields(fieldsNode, path, source);
        } else if (fieldsNode != null) {
            throw new SchemaDefinitionException(
                    "Invalid field definition '" + path + "' in " + source + ": 'fields' is only allowed on map"
                            + " fields, not on '" + type + "'",
                    definition.toString());
        }

        return new FieldDescriptor(name, type, repeated, children, description);
    }

    private void validateStructure(JsonNode definition, String location, String source) {
        Set<ValidationMessage> errors = fieldSchema.validate(definition);
        if (!errors.isEmpty()) {
            String detail = errors.stream()
                    .map(ValidationMessage::getMessage)
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new SchemaParseException("Invalid field definition at " + location + ": " + detail, source);
        }
    }

    private static void rejectUnknownRootKeys(JsonNode root, String source) {
        List<String> unknown = new ArrayList<>();
        root.fieldNames().forEachRemaining(key -> {
            if (!"fields".equals(key)) {
                unknown.add(key);
            }
        });
        if (!unknown.isEmpty()) {
            throw new SchemaParseException(
                    "Unknown key" + (unknown.size() > 1 ? "s" : "") + " in schema root: " + unknown
                            + " (recognized keys are: [fields])",
                    source);
        }
    }

    private static JsonSchema loadFieldSchema() {
        try (InputStream in = SchemaParser.class.getResourceAsStream(FIELD_SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + FIELD_SCHEMA_RESOURCE);
            }
            return SCHEMA_FACTORY.getSchema(YAML_MAPPER.readTree(in));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load " + FIELD_SCHEMA_RESOURCE, e);
        }
    }
}
