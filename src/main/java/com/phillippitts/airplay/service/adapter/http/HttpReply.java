package com.phillippitts.airplay.service.adapter.http;

/**
 * Status and body of an HTTP exchange.
 */
public record HttpReply(int status, String body) {

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }
}
