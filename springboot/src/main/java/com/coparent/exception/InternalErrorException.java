package com.coparent.exception;

import org.springframework.http.HttpStatus;

public class InternalErrorException extends ApiException {

    public InternalErrorException(String code, String message) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, code, message);
    }
}
