package com.phonos.commerce.service;

import com.phonos.commerce.model.CallEndedEvent;
import com.phonos.commerce.model.CallStatusEvent;
import com.phonos.commerce.model.Product;
import com.phonos.commerce.model.StoreCall;
import com.phonos.commerce.model.StoreCallStatus;
import com.phonos.commerce.model.TranscriptAnalysis;
import com.phonos.commerce.model.VoiceEvent;
import com.phonos.commerce.repository.ProductRepository;
import com.phonos.commerce.repository.StoreCallRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executor;

/**
 * Applies voice-provider events to store calls. End-of-call reports trigger transcript
 * analysis on the analysis executor; once a call settles its waiting future is completed.
 */
@Service
public class StoreCallEventHandler {

    private static final Logger logger = LoggerFactory.getLogger(StoreCallEventHandler.class);

    // ended reasons meaning nobody picked up
    private static final Set<String> NOT_CONNECTED_REASONS = Set.of(
            "customer-did-not-answer",
            "customer-busy",
            "voicemail",
            "twilio-failed-to-connect-call",
            "vonage-failed-to-connect-call",
            "customer-did-not-give-microphone-permission");

    private final StoreCallRepository storeCallRepository;
    private final ProductRepository productRepository;
    private final StoreCallStateService storeCallStateService;
    private final TranscriptAnalyzerService transcriptAnalyzerService;
    private final CallCompletionRegistry callCompletionRegistry;
    private final Executor analysisExecutor;

    public StoreCallEventHandler(StoreCallRepository storeCallRepository,
                                 ProductRepository productRepository,
                                 StoreCallStateService storeCallStateService,
                                 TranscriptAnalyzerService transcriptAnalyzerService,
                                 CallCompletionRegistry callCompletionRegistry,
                                 @Qualifier("analysisExecutor") Executor analysisExecutor) {
        this.storeCallRepository = storeCallRepository;
        this.productRepository = productRepository;
        this.storeCallStateService = storeCallStateService;
        this.transcriptAnalyzerService = transcriptAnalyzerService;
        this.callCompletionRegistry = callCompletionRegistry;
        this.analysisExecutor = analysisExecutor;
    }

    public void handle(VoiceEvent event) {
        Optional<StoreCall> call = storeCallRepository.findByProviderCallId(event.providerCallId());
        if (call.isEmpty()) {
            logger.info("Ignoring voice event {} for unknown call {}", event.eventId(), event.providerCallId());
            return;
        }
        Long storeCallId = call.get().getId();
        if (event instanceof CallStatusEvent statusEvent) {
            onStatus(storeCallId, statusEvent);
        } else if (event instanceof CallEndedEvent endedEvent) {
            onEnded(storeCallId, endedEvent);
        }
    }

    private void onStatus(Long storeCallId, CallStatusEvent event) {
        if (event.targetStatus() == null) {
            logger.debug("Store call {} provider status {} carries no transition", storeCallId, event.providerStatus());
            return;
        }
        storeCallStateService.advance(storeCallId, event.targetStatus());
    }

    private void onEnded(Long storeCallId, CallEndedEvent event) {
        Optional<StoreCall> completed = storeCallStateService.markCompleted(
                storeCallId, event.endedReason(), event.transcript());
        if (completed.isEmpty()) {
            logger.info("Store call {} already past completion, ignoring end-of-call report", storeCallId);
            return;
        }
        if (!StringUtils.hasText(event.transcript()) && event.endedReason() != null
                && NOT_CONNECTED_REASONS.contains(event.endedReason())) {
            settle(storeCallId, storeCallStateService.fail(storeCallId, event.endedReason()));
            return;
        }
        StoreCall storeCall = completed.get();
        analysisExecutor.execute(() -> analyzeAndSettle(storeCall, event.transcript()));
    }

    void analyzeAndSettle(StoreCall storeCall, String transcript) {
        Long storeCallId = storeCall.getId();
        try {
            Product product = productRepository.findByTicketId(storeCall.getTicketId()).orElse(null);
            TranscriptAnalysis analysis = transcriptAnalyzerService.analyze(transcript, product);
            settle(storeCallId, storeCallStateService.applyAnalysis(storeCallId, analysis));
        } catch (RuntimeException e) {
            logger.error("Analysis of store call {} failed", storeCallId, e);
            settle(storeCallId, storeCallStateService.fail(storeCallId, "analysis_error"));
        }
    }

    private void settle(Long storeCallId, StoreCallStatus status) {
        if (status != null && status.isSettled()) {
            callCompletionRegistry.complete(storeCallId, status);
        }
    }
}
