package com.phonos.commerce.model;

public enum Intent {
    ORDER_PRODUCT,
    WAKE_UP_CALL,
    OTHER;

    public static Intent fromLabel(String label) {
        if (label == null) {
            return OTHER;
        }
        String normalized = label.trim().toLowerCase();
        if (normalized.equals("order_product")) {
            return ORDER_PRODUCT;
        }
        if (normalized.equals("wake_up_call") || normalized.equals("wakeup_alarm")) {
            return WAKE_UP_CALL;
        }
        return OTHER;
    }

    public String wireName() {
        return name().toLowerCase();
    }
}
