package com.example.giveaway_system.platform;

public class ChatPlatformException extends RuntimeException {

    public ChatPlatformException(String message) {
        super(message);
    }

    public ChatPlatformException(String message, Throwable cause) {
        super(message, cause);
    }
}
