package com.paideia.backend.global.error;

import org.springframework.http.HttpStatus;

/**
 * Failure kinds raised by the category and role stores, with the HTTP status the
 * surrounding application answers with.
 */
public enum ProblemKind {

    INVALID_ARGUMENT(HttpStatus.BAD_REQUEST),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    CIRCULAR_REFERENCE(HttpStatus.CONFLICT),
    DEPTH_LIMIT_EXCEEDED(HttpStatus.UNPROCESSABLE_ENTITY),
    HAS_SUBCATEGORIES(HttpStatus.CONFLICT),
    HAS_COURSES(HttpStatus.CONFLICT);

    private final HttpStatus status;

    ProblemKind(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
