package com.vidnyan.doclint.domain.oracle;

import lombok.Getter;

/**
 * Normalized transport error: HTTP-class status plus the vendor's error type, if any.
 * Status is {@link #NO_STATUS} when the request never produced a response.
 */
@Getter
public class OracleTransportException extends RuntimeException {

    public static final int NO_STATUS = -1;

    private final int statusCode;
    private final String errorType;

    public OracleTransportException(int statusCode, String errorType, String message) {
        super(message);
        this.statusCode = statusCode;
        this.errorType = errorType;
    }

    public OracleTransportException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = NO_STATUS;
        this.errorType = null;
    }
}
