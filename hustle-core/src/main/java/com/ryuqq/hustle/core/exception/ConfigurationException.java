package com.ryuqq.hustle.core.exception;

/**
 * 잘못된 정책 설정 (예: maxAttempts &lt; 1).
 *
 * @author Hustle Team
 * @since 1.0.0
 */
public class ConfigurationException extends HustleException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
