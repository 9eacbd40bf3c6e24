package com.phillippitts.airplay.service.adapter.http;

import com.phillippitts.airplay.exception.AdapterException;
import com.phillippitts.airplay.exception.AdapterTimeoutException;

import java.net.http.HttpRequest;

/**
 * Seam over the HTTP client so adapters can be exercised against canned replies.
 */
public interface HttpTransport {

    /**
     * Sends the request and returns the reply whatever its status.
     *
     * @param adapterName adapter issuing the call, for error context
     * @throws AdapterTimeoutException if the request timeout elapses
     * @throws AdapterException on connection failure or interruption
     */
    HttpReply send(HttpRequest request, String adapterName);
}
