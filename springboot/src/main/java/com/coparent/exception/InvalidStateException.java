package com.coparent.exception;

import org.springframework.http.HttpStatus;

public class InvalidStateException extends ApiException {

    public InvalidStateException(String code, String message) {
        super(HttpStatus.BAD_REQUEST, code, message);
    }
}
