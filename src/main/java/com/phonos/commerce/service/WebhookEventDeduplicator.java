package com.phonos.commerce.service;

import com.phonos.commerce.model.ProcessedWebhookEvent;
import com.phonos.commerce.repository.ProcessedWebhookEventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Remembers webhook event ids so a redelivered event is handled once. Ids are kept for
 * {@code app.webhooks.dedupe-retention-hours} and then purged.
 */
@Service
public class WebhookEventDeduplicator {

    private static final Logger logger = LoggerFactory.getLogger(WebhookEventDeduplicator.class);

    private final ProcessedWebhookEventRepository repository;
    private final long retentionHours;
    private final AtomicBoolean purging = new AtomicBoolean(false);

    public WebhookEventDeduplicator(ProcessedWebhookEventRepository repository,
                                    @Value("${app.webhooks.dedupe-retention-hours:48}") long retentionHours) {
        this.repository = repository;
        this.retentionHours = retentionHours;
    }

    /**
     * Records the event id.
     *
     * @return true on first delivery, false when the id was seen before
     */
    public boolean markFirstDelivery(String eventId, String source) {
        if (repository.existsById(eventId)) {
            return false;
        }
        try {
            repository.saveAndFlush(new ProcessedWebhookEvent(eventId, source));
            return true;
        } catch (DataIntegrityViolationException e) {
            logger.debug("Concurrent duplicate {} event {}", source, eventId);
            return false;
        }
    }

    /**
     * Forgets an event id whose handling failed, so the provider's redelivery is processed.
     */
    public void release(String eventId, String source) {
        try {
            repository.deleteById(eventId);
            logger.info("Released {} event {} for redelivery", source, eventId);
        } catch (RuntimeException e) {
            logger.error("Could not release {} event {}; its redelivery will be treated as a duplicate",
                    source, eventId, e);
        }
    }

    @Scheduled(fixedDelayString = "${app.webhooks.purge-interval-ms:3600000}",
            initialDelayString = "${app.webhooks.purge-initial-delay-ms:60000}")
    public void purgeExpired() {
        if (!purging.compareAndSet(false, true)) {
            return;
        }
        try {
            int removed = repository.deleteReceivedBefore(OffsetDateTime.now().minusHours(retentionHours));
            if (removed > 0) {
                logger.info("Purged {} processed webhook events older than {}h", removed, retentionHours);
            }
        } finally {
            purging.set(false);
        }
    }
}
