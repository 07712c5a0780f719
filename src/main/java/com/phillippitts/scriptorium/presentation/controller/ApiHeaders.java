package com.phillippitts.scriptorium.presentation.controller;

/**
 * Request headers shared by the API controllers.
 */
final class ApiHeaders {

    /** Authenticated user id, set by the authentication layer in front of this service. */
    static final String USER_ID = "X-User-ID";

    private ApiHeaders() {}
}
