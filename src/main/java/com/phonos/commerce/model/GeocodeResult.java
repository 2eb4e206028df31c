package com.phonos.commerce.model;

public record GeocodeResult(
        double latitude,
        double longitude,
        String formattedAddress,
        String pincode,
        String city,
        String state) {
}
