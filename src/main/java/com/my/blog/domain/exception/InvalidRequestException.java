package com.my.blog.domain.exception;

/**
 * 왜: 비어 있는 slug 나 안전하지 않은 slug 처럼 호출자 입력이 잘못됐을 때 원격 호출 전에 실패시키기 위함.
 */
public class InvalidRequestException extends RuntimeException {
    public InvalidRequestException(String message) {
        super(message);
    }

    public InvalidRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
