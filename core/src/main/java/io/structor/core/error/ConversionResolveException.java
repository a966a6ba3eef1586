package io.structor.core.error;

/** Thrown when a schema document names a conversion id that is not registered. */
public final class ConversionResolveException extends SchemaLoadException {

    private static final long serialVersionUID = 1L;

    private final String conversionId;

    public ConversionResolveException(String message, String conversionId, String schemaName, String source) {
        super(message, schemaName, source);
        this.conversionId = conversionId;
    }

    /** The id that could not be resolved. */
    public String conversionId() {
        return conversionId;
    }
}
