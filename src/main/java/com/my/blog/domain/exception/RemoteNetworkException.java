package com.my.blog.domain.exception;

/**
 * 전송 실패 또는 예상하지 못한 HTTP 응답. 저장소 계층의 재시도 대상이다.
 */
public class RemoteNetworkException extends RemoteStoreException {

    public RemoteNetworkException(String operation, String path, String message) {
        super(operation, path, message, null);
    }

    public RemoteNetworkException(String operation, String path, String message, Throwable cause) {
        super(operation, path, message, cause);
    }
}
