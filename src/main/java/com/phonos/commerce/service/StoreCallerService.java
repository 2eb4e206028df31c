package com.phonos.commerce.service;

import com.google.common.util.concurrent.RateLimiter;
import com.phonos.commerce.exception.ErrorCode;
import com.phonos.commerce.exception.TicketStateConflictException;
import com.phonos.commerce.model.ProductAlternative;
import com.phonos.commerce.model.ProductResearch;
import com.phonos.commerce.model.Store;
import com.phonos.commerce.model.StoreCall;
import com.phonos.commerce.model.StoreCallStatus;
import com.phonos.commerce.repository.StoreCallRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Calls a ticket's ranked stores in parallel. A shared semaphore caps calls in flight across
 * all tickets, dials are paced by a rate limiter, and each call waits on a future that the
 * webhook side completes. A call that does not settle within the timeout is failed.
 */
@Service
public class StoreCallerService {

    private static final Logger logger = LoggerFactory.getLogger(StoreCallerService.class);

    static final String TIMEOUT_REASON = "timeout";
    static final String DIAL_FAILED_REASON = "dial_failed";

    private static final String FALLBACK_PROMPT = "You are calling {store_name} on behalf of a customer. "
            + "Ask politely whether they have {product} in stock right now ({specs}). "
            + "If not, ask about these alternatives: {alternatives}. "
            + "Ask the price, whether they deliver, how long delivery takes and what it costs. "
            + "Keep the call under two minutes and thank them before ending.";

    private final StoreCallStateService storeCallStateService;
    private final StoreCallRepository storeCallRepository;
    private final VapiVoiceClient vapiVoiceClient;
    private final CallCompletionRegistry callCompletionRegistry;
    private final PromptTemplateLoader promptTemplateLoader;
    private final Executor storeCallExecutor;
    private final Semaphore callPermits;
    private final RateLimiter telephonyRateLimiter;
    private final long callTimeoutSeconds;

    private final Set<UUID> activeBatches = ConcurrentHashMap.newKeySet();

    public StoreCallerService(StoreCallStateService storeCallStateService,
                              StoreCallRepository storeCallRepository,
                              VapiVoiceClient vapiVoiceClient,
                              CallCompletionRegistry callCompletionRegistry,
                              PromptTemplateLoader promptTemplateLoader,
                              @Qualifier("storeCallExecutor") Executor storeCallExecutor,
                              @Qualifier("callPermits") Semaphore callPermits,
                              @Qualifier("telephonyRateLimiter") RateLimiter telephonyRateLimiter,
                              @Value("${app.calls.timeout-seconds:600}") long callTimeoutSeconds) {
        this.storeCallStateService = storeCallStateService;
        this.storeCallRepository = storeCallRepository;
        this.vapiVoiceClient = vapiVoiceClient;
        this.callCompletionRegistry = callCompletionRegistry;
        this.promptTemplateLoader = promptTemplateLoader;
        this.storeCallExecutor = storeCallExecutor;
        this.callPermits = callPermits;
        this.telephonyRateLimiter = telephonyRateLimiter;
        this.callTimeoutSeconds = callTimeoutSeconds;
    }

    /**
     * Starts one call per store, in priority order, for at most {@code maxStores} stores.
     *
     * @return a future completing once every call has settled
     * @throws TicketStateConflictException when this ticket already has a call batch
     */
    public CompletableFuture<List<CallOutcome>> callStores(UUID ticketId, ProductResearch product,
                                                           List<Store> rankedStores, int maxStores) {
        if (!activeBatches.add(ticketId)) {
            throw new TicketStateConflictException(ErrorCode.CALL_BATCH_ALREADY_STARTED,
                    "Call batch already running for ticket " + ticketId);
        }
        if (storeCallRepository.existsByTicketId(ticketId)) {
            activeBatches.remove(ticketId);
            throw new TicketStateConflictException(ErrorCode.CALL_BATCH_ALREADY_STARTED,
                    "Stores were already called for ticket " + ticketId);
        }

        List<CompletableFuture<CallOutcome>> calls = new ArrayList<>();
        try {
            for (Store store : rankedStores.subList(0, Math.min(maxStores, rankedStores.size()))) {
                StoreCall call = storeCallStateService.createQueued(ticketId, store.getId());
                calls.add(launch(call, store, product));
            }
        } catch (RuntimeException e) {
            activeBatches.remove(ticketId);
            throw e;
        }
        logger.info("Ticket {}: launched {} store calls (timeout {}s each)", ticketId, calls.size(), callTimeoutSeconds);

        return CompletableFuture.allOf(calls.toArray(new CompletableFuture[0]))
                .thenApply(v -> calls.stream().map(CompletableFuture::join).collect(Collectors.toList()))
                .whenComplete((outcomes, ex) -> activeBatches.remove(ticketId));
    }

    boolean isBatchActive(UUID ticketId) {
        return activeBatches.contains(ticketId);
    }

    private CompletableFuture<CallOutcome> launch(StoreCall call, Store store, ProductResearch product) {
        Long callId = call.getId();
        return CompletableFuture
                .supplyAsync(() -> dial(callId, store, product), storeCallExecutor)
                .thenCompose(Function.identity())
                .exceptionally(ex -> {
                    logger.error("Store call {} to {} failed unexpectedly", callId, store.getName(), ex);
                    return new CallOutcome(callId, storeCallStateService.fail(callId, "error"), false);
                });
    }

    private CompletableFuture<CallOutcome> dial(Long callId, Store store, ProductResearch product) {
        try {
            callPermits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CompletableFuture.completedFuture(
                    new CallOutcome(callId, storeCallStateService.fail(callId, "interrupted"), false));
        }

        // The sweep may have failed the call while it waited for a permit.
        Optional<StoreCallStatus> settledWhileQueued = storeCallStateService.statusOf(callId)
                .filter(StoreCallStatus::isSettled);
        if (settledWhileQueued.isPresent()) {
            callPermits.release();
            logger.warn("Store call {} to {} settled as {} before dialing, not placing it", callId, store.getName(),
                    settledWhileQueued.get());
            return CompletableFuture.completedFuture(new CallOutcome(callId, settledWhileQueued.get(), false));
        }

        String providerCallId;
        try {
            providerCallId = dialWithRetry(store, product);
        } catch (RuntimeException e) {
            callPermits.release();
            logger.warn("Could not place call {} to {} ({}): {}", callId, store.getName(), store.getPhoneNumber(), e.getMessage());
            return CompletableFuture.completedFuture(
                    new CallOutcome(callId, storeCallStateService.fail(callId, DIAL_FAILED_REASON), false));
        }

        CompletableFuture<StoreCallStatus> settled = callCompletionRegistry.register(callId);
        boolean dialing;
        try {
            dialing = storeCallStateService.markDialing(callId, providerCallId);
        } catch (RuntimeException e) {
            callPermits.release();
            callCompletionRegistry.discard(callId);
            throw e;
        }
        if (!dialing) {
            callPermits.release();
            callCompletionRegistry.discard(callId);
            StoreCallStatus status = storeCallStateService.statusOf(callId).orElse(StoreCallStatus.FAILED);
            logger.warn("Store call {} settled as {} while provider call {} was being placed; excluding it",
                    callId, status, providerCallId);
            return CompletableFuture.completedFuture(new CallOutcome(callId, status, false));
        }

        return settled
                .orTimeout(callTimeoutSeconds, TimeUnit.SECONDS)
                .handleAsync((status, ex) -> {
                    callPermits.release();
                    if (ex == null) {
                        return new CallOutcome(callId, status, true);
                    }
                    callCompletionRegistry.discard(callId);
                    StoreCallStatus finalStatus = storeCallStateService.fail(callId, TIMEOUT_REASON);
                    logger.warn("Store call {} to {} timed out after {}s, now {}", callId, store.getName(),
                            callTimeoutSeconds, finalStatus);
                    return new CallOutcome(callId, finalStatus, true);
                }, storeCallExecutor);
    }

    private String dialWithRetry(Store store, ProductResearch product) {
        String prompt = buildPrompt(store, product);
        String firstMessage = "Hello, is this " + store.getName() + "? I'm calling to check whether you have "
                + product.productName() + " in stock.";
        telephonyRateLimiter.acquire();
        try {
            return vapiVoiceClient.placeStoreCall(store.getPhoneNumber(), prompt, firstMessage);
        } catch (ResourceAccessException e) {
            logger.warn("Dial to {} hit a transport error, retrying once: {}", store.getName(), e.getMessage());
            telephonyRateLimiter.acquire();
            return vapiVoiceClient.placeStoreCall(store.getPhoneNumber(), prompt, firstMessage);
        }
    }

    private String buildPrompt(Store store, ProductResearch product) {
        String specs = product.specs() == null || product.specs().isEmpty() ? "no specific requirements"
                : product.specs().entrySet().stream()
                        .map(e -> e.getKey() + ": " + e.getValue())
                        .collect(Collectors.joining(", "));
        String alternatives = product.alternatives() == null || product.alternatives().isEmpty() ? "none"
                : product.alternatives().stream().map(ProductAlternative::name).collect(Collectors.joining(", "));
        return promptTemplateLoader.render("store_caller", FALLBACK_PROMPT, Map.of(
                "store_name", store.getName(),
                "product", product.productName(),
                "specs", specs,
                "alternatives", alternatives));
    }
}
