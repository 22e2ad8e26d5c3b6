package com.ryuqq.hustle.core.spi;

/**
 * Chat completion provider 오류.
 *
 * <p>HTTP 응답 기반 오류이면 상태 코드를 담고, 그 외(네트워크, 파싱)에는 -1입니다.</p>
 *
 * @author Hustle Team
 * @since 1.0.0
 */
public class ChatCompletionException extends RuntimeException {

    private final int statusCode;

    public ChatCompletionException(String message) {
        this(message, -1, null);
    }

    public ChatCompletionException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public ChatCompletionException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * HTTP 상태 코드 조회.
     *
     * @return 상태 코드 (HTTP 오류가 아니면 -1)
     */
    public int statusCode() {
        return statusCode;
    }
}
