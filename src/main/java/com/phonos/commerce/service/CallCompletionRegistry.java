package com.phonos.commerce.service;

import com.phonos.commerce.model.StoreCallStatus;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Futures for calls in flight, keyed by store call id. The store caller waits on them and the
 * webhook side completes them once a call settles.
 */
@Component
public class CallCompletionRegistry {

    private final ConcurrentHashMap<Long, CompletableFuture<StoreCallStatus>> pending = new ConcurrentHashMap<>();

    public CompletableFuture<StoreCallStatus> register(Long storeCallId) {
        return pending.computeIfAbsent(storeCallId, id -> new CompletableFuture<>());
    }

    /**
     * Completes and forgets the future for this call, if one is registered.
     */
    public void complete(Long storeCallId, StoreCallStatus status) {
        CompletableFuture<StoreCallStatus> future = pending.remove(storeCallId);
        if (future != null) {
            future.complete(status);
        }
    }

    public void discard(Long storeCallId) {
        pending.remove(storeCallId);
    }

    int size() {
        return pending.size();
    }
}
