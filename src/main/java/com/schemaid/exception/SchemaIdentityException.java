package com.schemaid.exception;

/**
 * Root of every failure raised while computing a schema identifier.
 * An identifier is either fully computed or not produced at all.
 */
public class SchemaIdentityException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public SchemaIdentityException(String message) {
        super(message);
    }

    public SchemaIdentityException(String message, Throwable cause) {
        super(message, cause);
    }
}
