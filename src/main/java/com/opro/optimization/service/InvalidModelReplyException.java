package com.opro.optimization.service;

/**
 * A reply arrived but could not be used. Thrown inside a retry boundary so the attempt is repeated.
 */
class InvalidModelReplyException extends RuntimeException {

    InvalidModelReplyException(String message) {
        super(message);
    }
}
