package com.rankfusion.query.retrieval;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * The dense channel failed. Unlike the lexical channel there is nothing to fall back to.
 */
@ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
public class RetrievalException extends RuntimeException {

    public RetrievalException(String message, Throwable cause) {
        super(message, cause);
    }
}
