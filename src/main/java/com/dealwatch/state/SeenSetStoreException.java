package com.dealwatch.state;

public class SeenSetStoreException extends RuntimeException {
    public SeenSetStoreException(String message) {
        super(message);
    }

    public SeenSetStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
