package com.rankfusion.query.contract;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class ContractException extends RuntimeException {

    public ContractException(String message) {
        super(message);
    }
}
