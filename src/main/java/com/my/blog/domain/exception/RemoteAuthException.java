package com.my.blog.domain.exception;

public class RemoteAuthException extends RemoteStoreException {

    public RemoteAuthException(String operation, String path, String message) {
        super(operation, path, message, null);
    }

    public RemoteAuthException(String operation, String path, String message, Throwable cause) {
        super(operation, path, message, cause);
    }
}
