package com.phonos.commerce.service;

import com.phonos.commerce.model.ProcessedWebhookEvent;
import com.phonos.commerce.repository.ProcessedWebhookEventRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.OffsetDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WebhookEventDeduplicatorTest {

    @Mock
    private ProcessedWebhookEventRepository repository;

    private WebhookEventDeduplicator deduplicator;

    @BeforeEach
    void setUp() {
        deduplicator = new WebhookEventDeduplicator(repository, 48);
    }

    @Test
    void firstDeliveryIsRecorded() {
        when(repository.existsById("evt-1")).thenReturn(false);

        assertThat(deduplicator.markFirstDelivery("evt-1", "voice")).isTrue();

        ArgumentCaptor<ProcessedWebhookEvent> saved = ArgumentCaptor.forClass(ProcessedWebhookEvent.class);
        verify(repository).saveAndFlush(saved.capture());
        assertThat(saved.getValue().getEventId()).isEqualTo("evt-1");
        assertThat(saved.getValue().getSource()).isEqualTo("voice");
    }

    @Test
    void knownEventIsADuplicate() {
        when(repository.existsById("evt-1")).thenReturn(true);

        assertThat(deduplicator.markFirstDelivery("evt-1", "voice")).isFalse();
        verify(repository, never()).saveAndFlush(any());
    }

    @Test
    void concurrentInsertOfTheSameIdIsADuplicate() {
        when(repository.existsById("evt-2")).thenReturn(false);
        when(repository.saveAndFlush(any(ProcessedWebhookEvent.class)))
                .thenThrow(new DataIntegrityViolationException("duplicate key"));

        assertThat(deduplicator.markFirstDelivery("evt-2", "logistics")).isFalse();
    }

    @Test
    void releasedEventIsDeliveredAgain() {
        when(repository.existsById("evt-3")).thenReturn(false);

        deduplicator.release("evt-3", "voice");

        verify(repository).deleteById("evt-3");
        assertThat(deduplicator.markFirstDelivery("evt-3", "voice")).isTrue();
    }

    @Test
    void purgeRemovesRowsOlderThanRetention() {
        ArgumentCaptor<OffsetDateTime> cutoff = ArgumentCaptor.forClass(OffsetDateTime.class);
        when(repository.deleteReceivedBefore(cutoff.capture())).thenReturn(3);

        deduplicator.purgeExpired();

        assertThat(cutoff.getValue()).isBefore(OffsetDateTime.now().minusHours(47));
        assertThat(cutoff.getValue()).isAfter(OffsetDateTime.now().minusHours(49));
    }
}
