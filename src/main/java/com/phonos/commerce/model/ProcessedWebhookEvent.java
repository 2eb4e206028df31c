package com.phonos.commerce.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Persistable;

import java.time.OffsetDateTime;

/**
 * Marker row for a webhook delivery that has already been handled.
 */
@Entity
@Table(name = "processed_webhook_events")
@Getter
@NoArgsConstructor
public class ProcessedWebhookEvent implements Persistable<String> {

    @Id
    @Column(name = "event_id", nullable = false, updatable = false, length = 512)
    private String eventId;

    @Column(name = "source", nullable = false, length = 32)
    private String source;

    @Column(name = "received_at", nullable = false)
    private OffsetDateTime receivedAt;

    public ProcessedWebhookEvent(String eventId, String source) {
        this.eventId = eventId;
        this.source = source;
        this.receivedAt = OffsetDateTime.now();
    }

    @Override
    public String getId() {
        return eventId;
    }

    // always inserted, never merged, so a duplicate id fails on the primary key
    @Override
    @Transient
    public boolean isNew() {
        return true;
    }
}
