package com.phonos.commerce.model;

/**
 * A voice-provider webhook event that the service acts on.
 */
public interface VoiceEvent {

    /** Stable identifier used to drop duplicate deliveries. */
    String eventId();

    /** Provider-side id of the call this event belongs to. */
    String providerCallId();
}
