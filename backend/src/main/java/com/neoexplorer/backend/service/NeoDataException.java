package com.neoexplorer.backend.service;

public class NeoDataException extends RuntimeException {

    public NeoDataException(String message) {
        super(message);
    }

    public NeoDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
