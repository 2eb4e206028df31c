package com.phonos.commerce.service;

import com.phonos.commerce.model.StoreCallStatus;
import com.phonos.commerce.repository.StoreCallRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Fails calls that stopped progressing, including calls whose in-memory future was lost
 * to a restart.
 */
@Component
public class StoreCallTimeoutSweeper {

    private static final Logger logger = LoggerFactory.getLogger(StoreCallTimeoutSweeper.class);

    private static final EnumSet<StoreCallStatus> UNSETTLED = EnumSet.of(
            StoreCallStatus.QUEUED, StoreCallStatus.DIALING, StoreCallStatus.IN_PROGRESS, StoreCallStatus.COMPLETED);

    private final StoreCallRepository storeCallRepository;
    private final StoreCallStateService storeCallStateService;
    private final CallCompletionRegistry callCompletionRegistry;
    private final long staleAfterSeconds;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public StoreCallTimeoutSweeper(StoreCallRepository storeCallRepository,
                                   StoreCallStateService storeCallStateService,
                                   CallCompletionRegistry callCompletionRegistry,
                                   @Value("${app.calls.timeout-seconds:600}") long callTimeoutSeconds,
                                   @Value("${app.calls.sweep-grace-seconds:120}") long graceSeconds) {
        this.storeCallRepository = storeCallRepository;
        this.storeCallStateService = storeCallStateService;
        this.callCompletionRegistry = callCompletionRegistry;
        this.staleAfterSeconds = callTimeoutSeconds + graceSeconds;
    }

    @Scheduled(fixedDelayString = "${app.calls.sweep-interval-ms:60000}",
            initialDelayString = "${app.calls.sweep-initial-delay-ms:30000}")
    public void sweep() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        try {
            List<Long> stale = storeCallRepository.findStaleCallIds(UNSETTLED,
                    OffsetDateTime.now().minusSeconds(staleAfterSeconds));
            for (Long storeCallId : stale) {
                StoreCallStatus status = storeCallStateService.fail(storeCallId, StoreCallerService.TIMEOUT_REASON);
                callCompletionRegistry.complete(storeCallId, status);
            }
            if (!stale.isEmpty()) {
                logger.warn("Timed out {} stale store calls", stale.size());
            }
        } catch (RuntimeException e) {
            logger.error("Store call sweep failed", e);
        } finally {
            running.set(false);
        }
    }
}
