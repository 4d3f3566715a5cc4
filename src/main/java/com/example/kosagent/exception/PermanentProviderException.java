package com.example.kosagent.exception;

/**
 * 不可重试的提供方错误：鉴权失败、非法请求。直接切换到下一个提供方
 */
public class PermanentProviderException extends ProviderException {

    public PermanentProviderException(String provider, String message) {
        super(provider, message);
    }

    public PermanentProviderException(String provider, String message, Throwable cause) {
        super(provider, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
