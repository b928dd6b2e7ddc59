package com.my.blog.domain.exception;

/**
 * 이미 존재하는 경로. 폴더 생성에서는 호출자가 성공으로 취급한다.
 */
public class RemoteConflictException extends RemoteStoreException {

    public RemoteConflictException(String operation, String path, String message) {
        super(operation, path, message, null);
    }

    public RemoteConflictException(String operation, String path, String message, Throwable cause) {
        super(operation, path, message, cause);
    }
}
