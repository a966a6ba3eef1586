package io.structor.core.engine;

import io.structor.core.model.ConversionStep;
import io.structor.core.spi.BoundConversion;
import io.structor.core.spi.Conversion;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of named conversions referenced by id from YAML schema documents.
 * Thread-safe: registration and lookup can happen concurrently. Re-registering
 * an id replaces the previous conversion (last-write-wins).
 */
public final class ConversionRegistry {

    private final Map<String, Entry> conversions = new ConcurrentHashMap<>();

    /**
     * Registers a single-argument conversion.
     *
     * @throws NullPointerException     if id or conversion is null
     * @throws IllegalArgumentException if id is empty
     */
    public void register(String id, Conversion conversion) {
        Objects.requireNonNull(conversion, "conversion must not be null");
        conversions.put(requireId(id), new Entry(id, conversion, null));
    }

    /**
     * Registers a conversion that takes extra arguments from the schema
     * document ({@code {fn: id, args: [...]}}).
     *
     * @throws NullPointerException     if id or conversion is null
     * @throws IllegalArgumentException if id is empty
     */
    public void registerBound(String id, BoundConversion conversion) {
        Objects.requireNonNull(conversion, "conversion must not be null");
        conversions.put(requireId(id), new Entry(id, null, conversion));
    }

    /**
     * Looks up a conversion by id.
     *
     * @return the entry, or empty if not registered
     */
    public Optional<Entry> getConversion(String id) {
        return Optional.ofNullable(conversions.get(id));
    }

    /**
     * Looks up a conversion by id, throwing if not found.
     *
     * @throws IllegalArgumentException if no conversion is registered with the given id
     */
    public Entry requireConversion(String id) {
        return getConversion(id)
                .orElseThrow(() -> new IllegalArgumentException("No conversion registered for id: '" + id + "'"));
    }

    /** Returns {@code true} if a conversion with the given id is registered. */
    public boolean hasConversion(String id) {
        return conversions.containsKey(id);
    }

    /** Returns the number of registered conversions. */
    public int size() {
        return conversions.size();
    }

    private static String requireId(String id) {
        Objects.requireNonNull(id, "id must not be null");
        if (id.isEmpty()) {
            throw new IllegalArgumentException("conversion id must not be empty");
        }
        return id;
    }

    /**
     * A registered conversion. Exactly one of {@code conversion} and
     * {@code bound} is set.
     */
    public record Entry(String id, Conversion conversion, BoundConversion bound) {

        public boolean takesArgs() {
            return bound != null;
        }

        /**
         * Builds a step for this conversion.
         *
         * @param args arguments from the schema document; must be empty for a
         *             plain conversion
         * @throws IllegalArgumentException if arguments are given to a plain conversion
         */
        public ConversionStep toStep(List<Object> args) {
            if (bound != null) {
                return ConversionStep.bound(bound, args.toArray());
            }
            if (!args.isEmpty()) {
                throw new IllegalArgumentException("conversion '" + id + "' takes no arguments");
            }
            return ConversionStep.of(conversion);
        }
    }
}
