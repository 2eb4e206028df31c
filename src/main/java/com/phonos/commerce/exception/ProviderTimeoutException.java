package com.phonos.commerce.exception;

public class ProviderTimeoutException extends CommerceException {
    public ProviderTimeoutException(String detail, Throwable cause) {
        super(ErrorCode.PROVIDER_TIMEOUT, detail, cause);
    }
}
