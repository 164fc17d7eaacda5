package com.worktrack.workitems.exception;

/**
 * A request that is well-formed but breaks a domain rule, such as a blank work item title.
 */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
