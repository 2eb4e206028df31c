package com.phonos.commerce.service;

import com.phonos.commerce.model.StoreCallStatus;

/**
 * Final state of one call in a batch.
 *
 * @param dialed whether the voice provider accepted the call
 */
public record CallOutcome(Long storeCallId, StoreCallStatus status, boolean dialed) {
}
