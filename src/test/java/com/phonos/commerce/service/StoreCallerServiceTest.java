package com.phonos.commerce.service;

import com.google.common.util.concurrent.RateLimiter;
import com.phonos.commerce.exception.ErrorCode;
import com.phonos.commerce.exception.TicketStateConflictException;
import com.phonos.commerce.exception.UpstreamProviderException;
import com.phonos.commerce.model.ProductResearch;
import com.phonos.commerce.model.Store;
import com.phonos.commerce.model.StoreCall;
import com.phonos.commerce.model.StoreCallStatus;
import com.phonos.commerce.repository.StoreCallRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.client.ResourceAccessException;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StoreCallerServiceTest {

    private static final UUID TICKET_ID = UUID.randomUUID();

    @Mock
    private StoreCallStateService storeCallStateService;

    @Mock
    private StoreCallRepository storeCallRepository;

    @Mock
    private VapiVoiceClient vapiVoiceClient;

    private final CallCompletionRegistry callCompletionRegistry = new CallCompletionRegistry();
    private final Semaphore callPermits = new Semaphore(2);

    private final ProductResearch product = new ProductResearch("20W USB-C charger", "electronics",
            Map.of("wattage", "20W"), List.of(), new BigDecimal("1299"), "mobile accessories", List.of(), false);

    private StoreCallerService storeCallerService;

    @BeforeEach
    void setUp() {
        storeCallerService = new StoreCallerService(storeCallStateService, storeCallRepository, vapiVoiceClient,
                callCompletionRegistry, new PromptTemplateLoader(), Runnable::run, callPermits,
                RateLimiter.create(100.0), 1);
    }

    @Test
    void callThatNeverSettlesIsFailedOnTimeout() throws Exception {
        givenQueuedCall(101L, 1L);
        when(vapiVoiceClient.placeStoreCall(eq("+91 98450 12345"), anyString(), anyString())).thenReturn("vapi-1");
        when(storeCallStateService.markDialing(101L, "vapi-1")).thenReturn(true);
        when(storeCallStateService.fail(101L, StoreCallerService.TIMEOUT_REASON)).thenReturn(StoreCallStatus.FAILED);

        List<CallOutcome> outcomes = storeCallerService
                .callStores(TICKET_ID, product, List.of(store(1L, "+91 98450 12345")), 4)
                .get(5, TimeUnit.SECONDS);

        assertThat(outcomes).containsExactly(new CallOutcome(101L, StoreCallStatus.FAILED, true));
        assertThat(callPermits.availablePermits()).isEqualTo(2);
        assertThat(callCompletionRegistry.size()).isZero();
        assertThat(storeCallerService.isBatchActive(TICKET_ID)).isFalse();
    }

    @Test
    void batchSettlesWhenTheWebhookSideCompletesTheCall() throws Exception {
        givenQueuedCall(102L, 1L);
        when(vapiVoiceClient.placeStoreCall(anyString(), anyString(), anyString())).thenReturn("vapi-2");
        when(storeCallStateService.markDialing(102L, "vapi-2")).thenReturn(true);

        CompletableFuture<List<CallOutcome>> batch = storeCallerService
                .callStores(TICKET_ID, product, List.of(store(1L, "+91 98450 12345")), 4);
        assertThat(storeCallerService.isBatchActive(TICKET_ID)).isTrue();

        callCompletionRegistry.complete(102L, StoreCallStatus.ANALYZED);

        assertThat(batch.get(5, TimeUnit.SECONDS))
                .containsExactly(new CallOutcome(102L, StoreCallStatus.ANALYZED, true));
        assertThat(callPermits.availablePermits()).isEqualTo(2);
        verify(storeCallStateService, never()).fail(eq(102L), anyString());
    }

    @Test
    void dialRejectedByProviderFailsOnlyThatCall() throws Exception {
        givenQueuedCall(103L, 1L);
        when(vapiVoiceClient.placeStoreCall(anyString(), anyString(), anyString()))
                .thenThrow(new UpstreamProviderException(ErrorCode.VOICE_ERROR, "invalid number"));
        when(storeCallStateService.fail(103L, StoreCallerService.DIAL_FAILED_REASON)).thenReturn(StoreCallStatus.FAILED);

        List<CallOutcome> outcomes = storeCallerService
                .callStores(TICKET_ID, product, List.of(store(1L, "12345")), 4)
                .get(5, TimeUnit.SECONDS);

        assertThat(outcomes).containsExactly(new CallOutcome(103L, StoreCallStatus.FAILED, false));
        assertThat(callPermits.availablePermits()).isEqualTo(2);
        verify(vapiVoiceClient, times(1)).placeStoreCall(anyString(), anyString(), anyString());
    }

    @Test
    void transportErrorIsRetriedOnce() throws Exception {
        givenQueuedCall(104L, 1L);
        when(vapiVoiceClient.placeStoreCall(anyString(), anyString(), anyString()))
                .thenThrow(new ResourceAccessException("connection reset"))
                .thenReturn("vapi-4");
        when(storeCallStateService.markDialing(104L, "vapi-4")).thenReturn(true);

        CompletableFuture<List<CallOutcome>> batch = storeCallerService
                .callStores(TICKET_ID, product, List.of(store(1L, "+91 98450 12345")), 4);
        callCompletionRegistry.complete(104L, StoreCallStatus.UNANALYZABLE);

        assertThat(batch.get(5, TimeUnit.SECONDS))
                .containsExactly(new CallOutcome(104L, StoreCallStatus.UNANALYZABLE, true));
        verify(vapiVoiceClient, times(2)).placeStoreCall(anyString(), anyString(), anyString());
    }

    @Test
    void secondBatchForTheSameTicketIsRefused() {
        when(storeCallRepository.existsByTicketId(TICKET_ID)).thenReturn(true);

        assertThatThrownBy(() -> storeCallerService.callStores(TICKET_ID, product, List.of(store(1L, "1")), 4))
                .isInstanceOf(TicketStateConflictException.class);
        assertThat(storeCallerService.isBatchActive(TICKET_ID)).isFalse();
    }

    @Test
    void callsAtMostMaxStores() throws Exception {
        givenQueuedCall(105L, 1L);
        when(vapiVoiceClient.placeStoreCall(anyString(), anyString(), anyString())).thenReturn("vapi-5");
        when(storeCallStateService.markDialing(105L, "vapi-5")).thenReturn(true);

        CompletableFuture<List<CallOutcome>> batch = storeCallerService.callStores(TICKET_ID, product,
                List.of(store(1L, "+91 98450 12345"), store(2L, "+91 98450 54321")), 1);
        callCompletionRegistry.complete(105L, StoreCallStatus.ANALYZED);

        assertThat(batch.get(5, TimeUnit.SECONDS)).hasSize(1);
        verify(storeCallStateService, never()).createQueued(TICKET_ID, 2L);
    }

    @Test
    void callFailedBySweepWhileQueuedIsNeverDialed() throws Exception {
        givenQueuedCall(106L, 1L);
        when(storeCallStateService.statusOf(106L)).thenReturn(Optional.of(StoreCallStatus.FAILED));

        List<CallOutcome> outcomes = storeCallerService
                .callStores(TICKET_ID, product, List.of(store(1L, "+91 98450 12345")), 4)
                .get(5, TimeUnit.SECONDS);

        assertThat(outcomes).containsExactly(new CallOutcome(106L, StoreCallStatus.FAILED, false));
        verify(vapiVoiceClient, never()).placeStoreCall(anyString(), anyString(), anyString());
        verify(storeCallStateService, never()).markDialing(any(), any());
        assertThat(callPermits.availablePermits()).isEqualTo(2);
    }

    @Test
    void callSettledDuringDialReleasesItsPermitAtOnce() {
        givenQueuedCall(107L, 1L);
        when(storeCallStateService.statusOf(107L))
                .thenReturn(Optional.empty())
                .thenReturn(Optional.of(StoreCallStatus.FAILED));
        when(vapiVoiceClient.placeStoreCall(anyString(), anyString(), anyString())).thenReturn("vapi-7");
        when(storeCallStateService.markDialing(107L, "vapi-7")).thenReturn(false);

        CompletableFuture<List<CallOutcome>> batch = storeCallerService
                .callStores(TICKET_ID, product, List.of(store(1L, "+91 98450 12345")), 4);

        assertThat(batch).isCompleted();
        assertThat(batch.join()).containsExactly(new CallOutcome(107L, StoreCallStatus.FAILED, false));
        assertThat(callPermits.availablePermits()).isEqualTo(2);
        assertThat(callCompletionRegistry.size()).isZero();
        verify(storeCallStateService, never()).fail(eq(107L), anyString());
    }

    private void givenQueuedCall(Long callId, Long storeId) {
        StoreCall call = new StoreCall(TICKET_ID, storeId);
        call.setId(callId);
        when(storeCallStateService.createQueued(TICKET_ID, storeId)).thenReturn(call);
    }

    private static Store store(Long id, String phone) {
        return Store.builder().id(id).ticketId(TICKET_ID).name("Store " + id).phoneNumber(phone).build();
    }
}
