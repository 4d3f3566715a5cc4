package com.example.kosagent.exception;

/**
 * 可重试的提供方错误：超时、限流、5xx
 */
public class TransientProviderException extends ProviderException {

    public TransientProviderException(String provider, String message) {
        super(provider, message);
    }

    public TransientProviderException(String provider, String message, Throwable cause) {
        super(provider, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
