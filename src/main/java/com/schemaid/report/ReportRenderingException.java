package com.schemaid.report;

import com.schemaid.exception.SchemaIdentityException;

/**
 * Thrown when an identity report cannot be rendered or written.
 */
public class ReportRenderingException extends SchemaIdentityException {

    private static final long serialVersionUID = 1L;

    public ReportRenderingException(String message, Throwable cause) {
        super(message, cause);
    }
}
