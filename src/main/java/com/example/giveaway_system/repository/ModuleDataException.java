package com.example.giveaway_system.repository;

public class ModuleDataException extends RuntimeException {

    public ModuleDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
