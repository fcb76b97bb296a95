package com.coparent.service.push;

public class PushDeliveryException extends RuntimeException {

    public PushDeliveryException(String message) {
        super(message);
    }

    public PushDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
