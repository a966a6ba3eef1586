package io.structor.core.engine;

import io.structor.core.model.ConstructionOptions;
import io.structor.core.model.ConstructionResult;
import io.structor.core.model.Schema;
import io.structor.core.parser.SchemaParser;
import io.structor.core.spi.ConstructionHooks;
import io.structor.core.spi.ConstructionListener;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry-backed facade: loads schemas from YAML documents or takes them
 * programmatically, and builds records by schema name.
 *
 * <p>
 * Thread-safe: holds an immutable {@link SchemaRegistry} snapshot in an
 * {@link AtomicReference}. Registration swaps in a new snapshot; construction
 * calls that already captured the old one complete with it.
 */
public final class ConstructionEngine {

    private static final Logger LOG = LoggerFactory.getLogger(ConstructionEngine.class);

    private final SchemaParser schemaParser;
    private final ConstructionListener listener;
    private final AtomicReference<SchemaRegistry> registryRef = new AtomicReference<>(SchemaRegistry.empty());

    /**
     * Creates an engine without a listener.
     *
     * @param schemaParser the parser used for YAML schema documents
     */
    public ConstructionEngine(SchemaParser schemaParser) {
        this(schemaParser, null);
    }

    /**
     * Creates an engine with an optional listener.
     *
     * @param schemaParser the parser used for YAML schema documents
     * @param listener     lifecycle listener, may be null
     */
    public ConstructionEngine(SchemaParser schemaParser, ConstructionListener listener) {
        this.schemaParser = Objects.requireNonNull(schemaParser, "schemaParser must not be null");
        this.listener = listener; // nullable
    }

    /**
     * Registers a programmatically built schema, replacing any schema with the
     * same name.
     *
     * @return the constructor for the schema
     */
    public Constructor register(Schema schema) {
        Objects.requireNonNull(schema, "schema must not be null");
        Constructor constructor = new Constructor(schema, listener);
        registryRef.updateAndGet(old -> old.with(constructor));
        LOG.info("Schema registered: schema={}, fields={}", schema.name(), schema.size());
        notifySchemaLoaded(schema, null);
        return constructor;
    }

    /** Loads a schema document without hooks. */
    public Schema loadSchema(Path path) {
        return loadSchema(path, ConstructionHooks.NONE);
    }

    /**
     * Loads a YAML schema document and registers it.
     *
     * @param path  path to the document
     * @param hooks lifecycle hooks to attach
     * @return the loaded schema
     * @throws io.structor.core.error.SchemaParseException       if the document is invalid
     * @throws io.structor.core.error.ConversionResolveException if a conversion id is unknown
     */
    public Schema loadSchema(Path path, ConstructionHooks hooks) {
        String source = path.toString();
        try {
            Schema schema = schemaParser.parse(path, registryRef.get(), hooks, listener);
            install(schema, source);
            return schema;
        } catch (RuntimeException e) {
            notifySchemaRejected(source, e);
            throw e;
        }
    }

    /** Loads an in-memory schema document without hooks. */
    public Schema loadSchema(String yaml, String source) {
        return loadSchema(yaml, source, ConstructionHooks.NONE);
    }

    /**
     * Loads an in-memory YAML schema document and registers it.
     *
     * @param yaml   the document text
     * @param source a label for logs and errors
     * @param hooks  lifecycle hooks to attach
     * @return the loaded schema
     */
    public Schema loadSchema(String yaml, String source, ConstructionHooks hooks) {
        try {
            Schema schema = schemaParser.parse(yaml, source, registryRef.get(), hooks, listener);
            install(schema, source);
            return schema;
        } catch (RuntimeException e) {
            notifySchemaRejected(source, e);
            throw e;
        }
    }

    /**
     * Replaces every registered schema with the documents at {@code paths},
     * loaded in order (a document may nest schemas loaded before it). On
     * failure nothing is swapped in.
     */
    public void reload(List<Path> paths) {
        SchemaRegistry.Builder builder = SchemaRegistry.builder();
        SchemaRegistry staged = SchemaRegistry.empty();
        for (Path path : paths) {
            Schema schema;
            try {
                schema = schemaParser.parse(path, staged, ConstructionHooks.NONE, listener);
            } catch (RuntimeException e) {
                notifySchemaRejected(path.toString(), e);
                throw e;
            }
            builder.add(new Constructor(schema, listener));
            staged = builder.build();
            notifySchemaLoaded(schema, path.toString());
        }
        registryRef.set(staged);
        LOG.info("Registry reloaded: schemas={}", staged.schemaCount());
    }

    /**
     * Looks up the constructor of a registered schema.
     *
     * @return the constructor, or empty if not registered
     */
    public Optional<Constructor> constructor(String schemaName) {
        return Optional.ofNullable(registryRef.get().getConstructor(schemaName));
    }

    /**
     * Looks up a constructor, throwing if not found.
     *
     * @throws IllegalArgumentException if no schema is registered with the given name
     */
    public Constructor requireConstructor(String schemaName) {
        return constructor(schemaName)
                .orElseThrow(() -> new IllegalArgumentException("No schema registered with name: '" + schemaName + "'"));
    }

    /** Builds a record of the named schema with the schema's options. */
    public ConstructionResult construct(String schemaName, Object input) {
        return requireConstructor(schemaName).construct(input);
    }

    /** Builds a record of the named schema with call-site options. */
    public ConstructionResult construct(String schemaName, Object input, ConstructionOptions options) {
        return requireConstructor(schemaName).construct(input, options);
    }

    /** Current registry snapshot. */
    public SchemaRegistry registry() {
        return registryRef.get();
    }

    public int schemaCount() {
        return registryRef.get().schemaCount();
    }

    private void install(Schema schema, String source) {
        Constructor constructor = new Constructor(schema, listener);
        registryRef.updateAndGet(old -> old.with(constructor));
        LOG.info("Schema loaded: schema={}, fields={}, source={}", schema.name(), schema.size(), source);
        notifySchemaLoaded(schema, source);
    }

    // --- Listener notification helpers ---

    private void notifySchemaLoaded(Schema schema, String source) {
        if (listener == null) return;
        try {
            listener.onSchemaLoaded(new ConstructionListener.SchemaLoadedEvent(schema.name(), schema.size(), source));
        } catch (Exception e) {
            LOG.warn("ConstructionListener.onSchemaLoaded failed", e);
        }
    }

    private void notifySchemaRejected(String source, Exception cause) {
        LOG.warn("Schema rejected: source={}, reason={}", source, cause.getMessage());
        if (listener == null) return;
        try {
            listener.onSchemaRejected(new ConstructionListener.SchemaRejectedEvent(source, cause.getMessage()));
        } catch (Exception e) {
            LOG.warn("ConstructionListener.onSchemaRejected failed", e);
        }
    }
}
