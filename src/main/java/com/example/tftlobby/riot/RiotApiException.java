package com.example.tftlobby.riot;

import com.example.tftlobby.fetch.FetchResult;

/**
 * A bootstrap call failed for a reason other than the key: rate limit, timeout, network or server error.
 */
public class RiotApiException extends RuntimeException {

    private final FetchResult result;

    public RiotApiException(String message, FetchResult result) {
        super(message + ": " + result);
        this.result = result;
    }

    public FetchResult getResult() {
        return result;
    }
}
