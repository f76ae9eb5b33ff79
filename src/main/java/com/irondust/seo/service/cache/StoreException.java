package com.irondust.seo.service.cache;

/** A key-value store could not read or write its backing medium. */
public class StoreException extends RuntimeException {
    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
