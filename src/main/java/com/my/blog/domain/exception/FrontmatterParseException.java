package com.my.blog.domain.exception;

/**
 * 왜: frontmatter 구문 오류를 명시적으로 드러내 목록 조회에서 해당 파일만 건너뛸 수 있게 하기 위함.
 */
public class FrontmatterParseException extends RuntimeException {
    public FrontmatterParseException(String message) {
        super(message);
    }

    public FrontmatterParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
