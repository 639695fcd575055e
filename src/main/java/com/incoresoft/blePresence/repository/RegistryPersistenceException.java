package com.incoresoft.blePresence.repository;

public class RegistryPersistenceException extends RuntimeException {
    public RegistryPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
