package com.my.blog.domain.exception;

/**
 * 왜: 원격 파일 저장소 호출 실패에 어떤 작업과 경로였는지를 함께 실어 상위 계층이 문맥을 잃지 않도록 하기 위함.
 */
public abstract class RemoteStoreException extends RuntimeException {

    private final String operation;
    private final String path;

    protected RemoteStoreException(String operation, String path, String message, Throwable cause) {
        super(operation + " 실패 (path=" + path + "): " + message, cause);
        this.operation = operation;
        this.path = path;
    }

    public String operation() {
        return operation;
    }

    public String path() {
        return path;
    }
}
