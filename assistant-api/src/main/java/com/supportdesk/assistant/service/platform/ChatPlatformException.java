package com.supportdesk.assistant.service.platform;

public class ChatPlatformException extends RuntimeException {

    public ChatPlatformException(String message) {
        super(message);
    }

    public ChatPlatformException(String message, Throwable cause) {
        super(message, cause);
    }
}
