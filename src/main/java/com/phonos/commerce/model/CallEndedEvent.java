package com.phonos.commerce.model;

/**
 * An {@code end-of-call-report}: the call is over and its transcript is ready.
 */
public record CallEndedEvent(String eventId, String providerCallId, String endedReason,
                             String transcript) implements VoiceEvent {
}
