package com.phonos.commerce.model;

import java.util.UUID;

/**
 * A callable store as returned by the maps provider, before it is persisted for a ticket.
 */
public record StoreCandidate(
        String placeId,
        String name,
        String address,
        String phoneNumber,
        Double rating,
        Integer totalRatings,
        Double latitude,
        Double longitude) {

    public Store toStore(UUID ticketId, int discoveryOrder) {
        return Store.builder()
                .ticketId(ticketId)
                .placeId(placeId)
                .name(name)
                .address(address)
                .phoneNumber(phoneNumber)
                .rating(rating)
                .totalRatings(totalRatings)
                .latitude(latitude)
                .longitude(longitude)
                .discoveryOrder(discoveryOrder)
                .build();
    }
}
