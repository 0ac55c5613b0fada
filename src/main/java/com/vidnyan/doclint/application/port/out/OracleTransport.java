package com.vidnyan.doclint.application.port.out;

import com.vidnyan.doclint.domain.oracle.OracleTransportException;

/**
 * Port for the text-generation oracle.
 * Implemented by adapters that talk to a concrete LLM vendor.
 */
public interface OracleTransport {

    /**
     * Send one prompt and return the raw response text.
     * @throws OracleTransportException with the HTTP-class status of a failed call
     */
    String call(String prompt);

    /**
     * Model name reported in the run summary.
     */
    String model();
}
