package com.rankfusion.ingestion.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Rejected feedback input: unknown outcome label, unknown thumb vote, missing id or event
 * type, unknown batch source.
 */
@ResponseStatus(HttpStatus.BAD_REQUEST)
public class InvalidFeedbackException extends RuntimeException {
    public InvalidFeedbackException(String message) {
        super(message);
    }

    public InvalidFeedbackException(String message, Throwable cause) {
        super(message, cause);
    }
}
