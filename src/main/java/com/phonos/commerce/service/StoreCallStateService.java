package com.phonos.commerce.service;

import com.phonos.commerce.model.StoreCall;
import com.phonos.commerce.model.StoreCallStatus;
import com.phonos.commerce.model.TranscriptAnalysis;
import com.phonos.commerce.repository.StoreCallRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * All writes to {@link StoreCall} rows. Each method locks the row, applies a forward-only
 * transition and reports whether anything changed.
 */
@Service
public class StoreCallStateService {

    private static final Logger logger = LoggerFactory.getLogger(StoreCallStateService.class);

    private final StoreCallRepository storeCallRepository;

    public StoreCallStateService(StoreCallRepository storeCallRepository) {
        this.storeCallRepository = storeCallRepository;
    }

    @Transactional
    public StoreCall createQueued(UUID ticketId, Long storeId) {
        return storeCallRepository.save(new StoreCall(ticketId, storeId));
    }

    /**
     * Records the provider's call id and moves the call to {@link StoreCallStatus#DIALING}.
     * A call that was already settled (for example by the timeout sweep) is left untouched.
     */
    @Transactional
    public boolean markDialing(Long storeCallId, String providerCallId) {
        return storeCallRepository.findByIdForUpdate(storeCallId)
                .filter(call -> apply(call, StoreCallStatus.DIALING))
                .map(call -> {
                    call.setProviderCallId(providerCallId);
                    return true;
                })
                .orElse(false);
    }

    @Transactional(readOnly = true)
    public Optional<StoreCallStatus> statusOf(Long storeCallId) {
        return storeCallRepository.findById(storeCallId).map(StoreCall::getStatus);
    }

    /**
     * Applies a provider status update. Equal or lower ranks are ignored.
     */
    @Transactional
    public boolean advance(Long storeCallId, StoreCallStatus next) {
        return storeCallRepository.findByIdForUpdate(storeCallId)
                .map(call -> apply(call, next))
                .orElse(false);
    }

    /**
     * Records the end-of-call report and moves the call to {@link StoreCallStatus#COMPLETED}.
     *
     * @return the updated call when the transition happened
     */
    @Transactional
    public Optional<StoreCall> markCompleted(Long storeCallId, String endedReason, String transcript) {
        return storeCallRepository.findByIdForUpdate(storeCallId)
                .filter(call -> apply(call, StoreCallStatus.COMPLETED))
                .map(call -> {
                    call.setEndedReason(endedReason);
                    call.setTranscript(transcript);
                    return call;
                });
    }

    @Transactional
    public StoreCallStatus applyAnalysis(Long storeCallId, TranscriptAnalysis analysis) {
        StoreCall call = storeCallRepository.findByIdForUpdate(storeCallId).orElse(null);
        if (call == null) {
            return null;
        }
        if (!analysis.analyzable()) {
            call.setNotes(analysis.notes());
            apply(call, StoreCallStatus.UNANALYZABLE);
            return call.getStatus();
        }
        if (apply(call, StoreCallStatus.ANALYZED)) {
            call.setProductAvailable(analysis.productAvailable());
            call.setMatchedProduct(analysis.matchedProduct());
            call.setPrice(analysis.price());
            call.setMatchType(analysis.matchType());
            call.setDeliveryAvailable(analysis.deliveryAvailable());
            call.setDeliveryEta(analysis.deliveryEta());
            call.setDeliveryCharge(analysis.deliveryCharge());
            call.setDeliveryMode(analysis.deliveryMode());
            call.setSummary(analysis.summary());
            call.setNotes(analysis.notes());
            call.setAnalysis(new LinkedHashMap<>(analysis.raw()));
        }
        return call.getStatus();
    }

    /**
     * Fails an unsettled call. Settled calls keep their status.
     *
     * @return the call's status after the attempt
     */
    @Transactional
    public StoreCallStatus fail(Long storeCallId, String endedReason) {
        StoreCall call = storeCallRepository.findByIdForUpdate(storeCallId).orElse(null);
        if (call == null) {
            return null;
        }
        if (apply(call, StoreCallStatus.FAILED)) {
            call.setEndedReason(endedReason);
            Map<String, Object> analysis = new LinkedHashMap<>();
            analysis.put("call_connected", false);
            analysis.put("ended_reason", endedReason);
            call.setAnalysis(analysis);
        }
        return call.getStatus();
    }

    private boolean apply(StoreCall call, StoreCallStatus next) {
        StoreCallStatus previous = call.getStatus();
        if (!call.advanceTo(next)) {
            logger.debug("Store call {} ignored transition {} -> {}", call.getId(), previous, next);
            return false;
        }
        logger.info("Store call {} (ticket {}): {} -> {}", call.getId(), call.getTicketId(), previous, next);
        return true;
    }
}
