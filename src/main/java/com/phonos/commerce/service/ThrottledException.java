package com.phonos.commerce.service;

/**
 * Bedrock kept throttling after every backoff attempt.
 */
public class ThrottledException extends RuntimeException {
    public ThrottledException(String m) { super(m); }

    public ThrottledException(String m, Throwable c) { super(m, c); }
}
