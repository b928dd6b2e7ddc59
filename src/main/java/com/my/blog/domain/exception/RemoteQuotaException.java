package com.my.blog.domain.exception;

/**
 * 원격 API 자체의 쿼터/용량 초과. 내부 RateLimiter 와는 별개다.
 */
public class RemoteQuotaException extends RemoteStoreException {

    public RemoteQuotaException(String operation, String path, String message) {
        super(operation, path, message, null);
    }

    public RemoteQuotaException(String operation, String path, String message, Throwable cause) {
        super(operation, path, message, cause);
    }
}
