package com.phonos.commerce.exception;

/**
 * A maps, voice, logistics or LLM provider answered with an error or an unusable payload.
 */
public class UpstreamProviderException extends CommerceException {
    public UpstreamProviderException(ErrorCode errorCode, String detail) {
        super(errorCode, detail);
    }

    public UpstreamProviderException(ErrorCode errorCode, String detail, Throwable cause) {
        super(errorCode, detail, cause);
    }
}
