package com.example.tftlobby.fetch;

public enum FailureKind {
    AUTH,
    RATE_LIMITED,
    TIMEOUT,
    NETWORK,
    HTTP_STATUS,
    PARSE
}
