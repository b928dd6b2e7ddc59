package com.my.blog.domain.exception;

public class RemoteNotFoundException extends RemoteStoreException {

    public RemoteNotFoundException(String operation, String path, String message) {
        super(operation, path, message, null);
    }

    public RemoteNotFoundException(String operation, String path, String message, Throwable cause) {
        super(operation, path, message, cause);
    }
}
