package com.phonos.commerce.model;

/**
 * A {@code status-update} event. {@code targetStatus} is null for provider statuses that
 * carry no transition (for example {@code ended}, which is followed by the end-of-call report).
 */
public record CallStatusEvent(String eventId, String providerCallId, String providerStatus,
                              StoreCallStatus targetStatus) implements VoiceEvent {
}
