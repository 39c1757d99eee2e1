package com.example.tftlobby.fetch;

/**
 * Outcome of one logical fetch: a body, a legitimate "not found", or a terminal failure.
 */
public class FetchResult {

    public enum Status {
        OK, NOT_FOUND, FAILURE
    }

    public final Status status;
    public final int httpStatus;     // 0 when no response was received
    public final String body;        // only for OK
    public final FailureKind failureKind;
    public final String url;

    private FetchResult(Status status, int httpStatus, String body, FailureKind failureKind, String url) {
        this.status = status;
        this.httpStatus = httpStatus;
        this.body = body;
        this.failureKind = failureKind;
        this.url = url;
    }

    public static FetchResult ok(int httpStatus, String body, String url) {
        return new FetchResult(Status.OK, httpStatus, body == null ? "" : body, null, url);
    }

    public static FetchResult notFound(String url) {
        return new FetchResult(Status.NOT_FOUND, 404, null, null, url);
    }

    public static FetchResult failure(FailureKind kind, int httpStatus, String url) {
        return new FetchResult(Status.FAILURE, httpStatus, null, kind, url);
    }

    public boolean isOk() {
        return status == Status.OK;
    }

    public boolean isNotFound() {
        return status == Status.NOT_FOUND;
    }

    public boolean isFailure() {
        return status == Status.FAILURE;
    }

    @Override
    public String toString() {
        if (status == Status.FAILURE) {
            return "FAILURE(" + failureKind + (httpStatus > 0 ? " " + httpStatus : "") + ") " + url;
        }
        return status + " " + url;
    }
}
