package io.structor.core.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.structor.core.engine.ConversionRegistry;
import io.structor.core.engine.Constructor;
import io.structor.core.engine.SchemaRegistry;
import io.structor.core.error.ConversionResolveException;
import io.structor.core.error.SchemaParseException;
import io.structor.core.model.ConstructionOptions;
import io.structor.core.model.ConversionStep;
import io.structor.core.model.FieldDescriptor;
import io.structor.core.model.Schema;
import io.structor.core.model.StepResult;
import io.structor.core.spi.ConstructionHooks;
import io.structor.core.spi.ConstructionListener;
import io.structor.core.spi.Conversion;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Parses YAML schema documents into {@link Schema} instances.
 *
 * <p>
 * Every document is first validated against the bundled
 * {@code schema-definition.json}. Conversion ids are resolved through the
 * {@link ConversionRegistry}; nested {@code {schema: Name}} steps are resolved
 * against the schemas already registered, or against the document's own schema
 * for self-references.
 *
 * <p>
 * Thread-safe if the underlying {@link ConversionRegistry} is (it is).
 */
public final class SchemaParser {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);
    private static final String DEFINITION_RESOURCE = "schema-definition.json";
    private static final JsonSchema DOCUMENT_SCHEMA = loadDocumentSchema();

    private final ConversionRegistry conversionRegistry;

    /**
     * Creates a new parser backed by the given conversion registry.
     *
     * @param conversionRegistry registry for resolving conversion ids
     */
    public SchemaParser(ConversionRegistry conversionRegistry) {
        this.conversionRegistry =
                Objects.requireNonNull(conversionRegistry, "conversionRegistry must not be null");
    }

    public ConversionRegistry conversionRegistry() {
        return conversionRegistry;
    }

    /**
     * Parses the YAML file at the given path.
     *
     * @param path  path to the schema YAML file
     * @param known schemas available to nested {@code schema} steps
     * @param hooks lifecycle hooks to attach to the schema
     * @return the parsed schema
     * @throws SchemaParseException        if the YAML is unreadable, violates the
     *                                     document schema, or references an
     *                                     unknown nested schema
     * @throws ConversionResolveException  if a conversion id is not registered
     */
    public Schema parse(Path path, SchemaRegistry known, ConstructionHooks hooks) {
        return parse(path, known, hooks, null);
    }

    /**
     * Parses the YAML file at the given path; constructions through a
     * self-referencing field report to {@code listener}.
     *
     * @param listener lifecycle listener for self-referencing fields, may be null
     * @see #parse(Path, SchemaRegistry, ConstructionHooks)
     */
    public Schema parse(Path path, SchemaRegistry known, ConstructionHooks hooks, ConstructionListener listener) {
        Objects.requireNonNull(path, "path must not be null");
        String source = path.toString();
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(path.toFile());
        } catch (IOException e) {
            throw new SchemaParseException("Failed to read or parse YAML: " + e.getMessage(), e, null, source);
        }
        return parseTree(root, source, known, hooks, listener);
    }

    /**
     * Parses a YAML document held in memory.
     *
     * @param yaml   the document text
     * @param source a label for error messages (file name, URL, ...)
     * @see #parse(Path, SchemaRegistry, ConstructionHooks)
     */
    public Schema parse(String yaml, String source, SchemaRegistry known, ConstructionHooks hooks) {
        return parse(yaml, source, known, hooks, null);
    }

    /** In-memory variant of {@link #parse(Path, SchemaRegistry, ConstructionHooks, ConstructionListener)}. */
    public Schema parse(
            String yaml, String source, SchemaRegistry known, ConstructionHooks hooks, ConstructionListener listener) {
        Objects.requireNonNull(yaml, "yaml must not be null");
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(yaml);
        } catch (IOException e) {
            throw new SchemaParseException("Failed to parse YAML: " + e.getMessage(), e, null, source);
        }
        return parseTree(root, source, known, hooks, listener);
    }

    private Schema parseTree(
            JsonNode root, String source, SchemaRegistry known, ConstructionHooks hooks, ConstructionListener listener) {
        Objects.requireNonNull(known, "known must not be null");
        Objects.requireNonNull(hooks, "hooks must not be null");
        if (root == null || root.isNull() || root.isMissingNode()) {
            throw new SchemaParseException("Schema document is empty", null, source);
        }
        validateDocument(root, source);

        String name = root.get("schema").asText();
        SelfReference self = new SelfReference(name);

        Schema.Builder builder = Schema.builder(name).options(parseOptions(root.get("options"))).hooks(hooks);
        Set<String> seen = new HashSet<>();
        for (JsonNode fieldNode : root.get("fields")) {
            String fieldName = fieldNode.get("name").asText();
            if (!seen.add(fieldName)) {
                throw new SchemaParseException("Duplicate field '" + fieldName + "'", name, source);
            }
            builder.field(parseField(fieldNode, fieldName, name, source, known, self));
        }
        Schema schema = builder.build();
        self.bind(schema, listener);
        return schema;
    }

    private FieldDescriptor parseField(
            JsonNode node, String fieldName, String schemaName, String source, SchemaRegistry known, SelfReference self) {
        FieldDescriptor.Builder field = FieldDescriptor.builder(fieldName);
        JsonNode required = node.get("required");
        if (required != null && required.asBoolean()) {
            field.required();
        }
        if (node.has("default")) {
            field.defaultValue(toJava(node.get("default")));
        }
        List<ConversionStep> steps = new ArrayList<>();
        JsonNode stepsNode = node.get("steps");
        if (stepsNode != null) {
            for (JsonNode stepNode : stepsNode) {
                steps.add(parseStep(stepNode, fieldName, schemaName, source, known, self));
            }
        }
        return field.steps(steps.toArray(new ConversionStep[0])).build();
    }

    private ConversionStep parseStep(
            JsonNode node, String fieldName, String schemaName, String source, SchemaRegistry known, SelfReference self) {
        if (node.isTextual()) {
            return resolveConversion(node.asText(), List.of(), fieldName, schemaName, source);
        }
        if (node.has("schema")) {
            String nested = node.get("schema").asText();
            if (nested.equals(schemaName)) {
                return ConversionStep.of(self);
            }
            Constructor constructor = known.getConstructor(nested);
            if (constructor == null) {
                throw new SchemaParseException(
                        "Unknown nested schema '" + nested + "' in field '" + fieldName + "'", schemaName, source);
            }
            return constructor.asStep();
        }
        List<Object> args = new ArrayList<>();
        JsonNode argsNode = node.get("args");
        if (argsNode != null) {
            argsNode.forEach(arg -> args.add(toJava(arg)));
        }
        return resolveConversion(node.get("fn").asText(), args, fieldName, schemaName, source);
    }

    private ConversionStep resolveConversion(
            String id, List<Object> args, String fieldName, String schemaName, String source) {
        ConversionRegistry.Entry entry = conversionRegistry
                .getConversion(id)
                .orElseThrow(() -> new ConversionResolveException(
                        "Unknown conversion '" + id + "' in field '" + fieldName + "'", id, schemaName, source));
        try {
            return entry.toStep(args);
        } catch (IllegalArgumentException e) {
            throw new SchemaParseException(
                    "Invalid step in field '" + fieldName + "': " + e.getMessage(), e, schemaName, source);
        }
    }

    private static ConstructionOptions parseOptions(JsonNode node) {
        ConstructionOptions options = ConstructionOptions.NONE;
        if (node == null) {
            return options;
        }
        if (node.has("nil-to-empty")) {
            options = options.withNilToEmpty(node.get("nil-to-empty").asBoolean());
        }
        if (node.has("check-keys")) {
            options = options.withCheckKeys(node.get("check-keys").asBoolean());
        }
        return options;
    }

    private static void validateDocument(JsonNode root, String source) {
        Set<ValidationMessage> errors = DOCUMENT_SCHEMA.validate(root);
        if (!errors.isEmpty()) {
            String detail = errors.stream()
                    .map(ValidationMessage::getMessage)
                    .sorted()
                    .collect(Collectors.joining("; "));
            JsonNode nameNode = root.get("schema");
            String name = nameNode != null && nameNode.isTextual() ? nameNode.asText() : null;
            throw new SchemaParseException("Invalid schema document: " + detail, name, source);
        }
    }

    /** YAML scalars as Java values: integral numbers as Long, other numbers as Double. */
    static Object toJava(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isIntegralNumber()) {
            return node.longValue();
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        if (node.isArray()) {
            List<Object> list = new ArrayList<>();
            node.forEach(element -> list.add(toJava(element)));
            return list;
        }
        Map<String, Object> map = new LinkedHashMap<>();
        node.fields().forEachRemaining(entry -> map.put(entry.getKey(), toJava(entry.getValue())));
        return map;
    }

    private static JsonSchema loadDocumentSchema() {
        try (InputStream in = SchemaParser.class.getResourceAsStream(DEFINITION_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource: " + DEFINITION_RESOURCE);
            }
            return SCHEMA_FACTORY.getSchema(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load " + DEFINITION_RESOURCE, e);
        }
    }

    /** Nested step pointing at the schema being parsed; bound once the schema is built. */
    private static final class SelfReference implements Conversion {

        private final String schemaName;
        private volatile Constructor constructor;

        SelfReference(String schemaName) {
            this.schemaName = schemaName;
        }

        void bind(Schema schema, ConstructionListener listener) {
            this.constructor = new Constructor(schema, listener);
        }

        @Override
        public StepResult apply(Object value) {
            Constructor bound = constructor;
            if (bound == null) {
                throw new IllegalStateException("Schema '" + schemaName + "' is not built yet");
            }
            return bound.apply(value);
        }
    }
}
