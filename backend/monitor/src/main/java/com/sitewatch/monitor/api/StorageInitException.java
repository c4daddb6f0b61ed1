package com.sitewatch.monitor.api;

public class StorageInitException extends StorageException {
    public StorageInitException(String message, Throwable cause) {
        super(message, cause);
    }
}
