package com.acme.fleet.admission.util;

/**
 * HTTP status codes returned by the telemetry endpoints.
 */
public final class HttpStatusCodes {
    public static final int OK = 200;
    public static final int METHOD_NOT_ALLOWED = 405;
    public static final int INTERNAL_ERROR = 500;

    private HttpStatusCodes() {
    }
}
