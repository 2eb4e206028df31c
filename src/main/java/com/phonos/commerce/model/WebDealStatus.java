package com.phonos.commerce.model;

public enum WebDealStatus {
    FOUND,
    EMPTY,
    FAILED,
    TIMED_OUT;

    public String wireName() {
        return name().toLowerCase();
    }
}
