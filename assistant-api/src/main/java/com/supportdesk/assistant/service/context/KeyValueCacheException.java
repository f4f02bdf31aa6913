package com.supportdesk.assistant.service.context;

public class KeyValueCacheException extends RuntimeException {

    public KeyValueCacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
