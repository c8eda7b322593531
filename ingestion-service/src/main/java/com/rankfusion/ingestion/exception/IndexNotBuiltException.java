package com.rankfusion.ingestion.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class IndexNotBuiltException extends RuntimeException {
    public IndexNotBuiltException() {
        super("Index not built. Run a build first.");
    }
}
