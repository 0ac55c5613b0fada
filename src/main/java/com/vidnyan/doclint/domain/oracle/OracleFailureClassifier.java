package com.vidnyan.doclint.domain.oracle;

import java.util.Locale;

/**
 * Fixed error taxonomy for oracle calls.
 * <ul>
 *   <li>429 and 5xx are retryable</li>
 *   <li>402 or an {@code insufficient_quota} error type is fatal and marks the quota as exhausted</li>
 *   <li>everything else, including errors without any status, is fatal</li>
 * </ul>
 */
public final class OracleFailureClassifier {

    public static final String INSUFFICIENT_QUOTA = "insufficient_quota";

    private OracleFailureClassifier() {
    }

    public static OracleFailure classify(Throwable error) {
        String message = describe(error);
        if (!(error instanceof OracleTransportException transport)) {
            return new OracleFailure.FatalFailure(OracleTransportException.NO_STATUS, message, false);
        }

        int status = transport.getStatusCode();
        if (isQuotaExhausted(status, transport.getErrorType())) {
            return new OracleFailure.FatalFailure(status, message, true);
        }
        if (status == 429 || status >= 500) {
            return new OracleFailure.RetryableFailure(status, message);
        }
        return new OracleFailure.FatalFailure(status, message, false);
    }

    private static boolean isQuotaExhausted(int status, String errorType) {
        return status == 402
                || (errorType != null && INSUFFICIENT_QUOTA.equals(errorType.toLowerCase(Locale.ROOT)));
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message != null && !message.isBlank() ? message : error.getClass().getSimpleName();
    }
}
