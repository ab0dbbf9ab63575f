package com.schemaid.exception;

/**
 * Thrown when a schema construct is met that this engine version cannot canonicalize.
 * Skipping the construct would let two different schemas share an identifier.
 */
public class UnsupportedSchemaNodeException extends SchemaIdentityException {

    private static final long serialVersionUID = 1L;

    private final String construct;
    private final String location;

    public UnsupportedSchemaNodeException(String construct, String location) {
        super("Unsupported schema construct '" + construct + "' at " + location);
        this.construct = construct;
        this.location = location;
    }

    public String getConstruct() {
        return construct;
    }

    public String getLocation() {
        return location;
    }
}
