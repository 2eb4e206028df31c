package com.phonos.commerce.service;

import com.phonos.commerce.model.StoreCall;
import com.phonos.commerce.model.StoreCallStatus;
import com.phonos.commerce.repository.StoreCallRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StoreCallStateServiceTest {

    @Mock
    private StoreCallRepository storeCallRepository;

    private StoreCallStateService storeCallStateService;
    private StoreCall call;

    @BeforeEach
    void setUp() {
        storeCallStateService = new StoreCallStateService(storeCallRepository);
        call = new StoreCall(UUID.randomUUID(), 1L);
        call.setId(31L);
    }

    @Test
    void markDialingRecordsProviderCallId() {
        when(storeCallRepository.findByIdForUpdate(31L)).thenReturn(Optional.of(call));

        assertThat(storeCallStateService.markDialing(31L, "vapi-31")).isTrue();

        assertThat(call.getStatus()).isEqualTo(StoreCallStatus.DIALING);
        assertThat(call.getProviderCallId()).isEqualTo("vapi-31");
    }

    @Test
    void markDialingLeavesTimedOutCallUntouched() {
        when(storeCallRepository.findByIdForUpdate(31L)).thenReturn(Optional.of(call));
        assertThat(storeCallStateService.fail(31L, StoreCallerService.TIMEOUT_REASON)).isEqualTo(StoreCallStatus.FAILED);

        assertThat(storeCallStateService.markDialing(31L, "vapi-late")).isFalse();

        assertThat(call.getStatus()).isEqualTo(StoreCallStatus.FAILED);
        assertThat(call.getProviderCallId()).isNull();
        assertThat(call.getEndedReason()).isEqualTo("timeout");
    }

    @Test
    void statusOfReadsCurrentRow() {
        call.setStatus(StoreCallStatus.IN_PROGRESS);
        when(storeCallRepository.findById(31L)).thenReturn(Optional.of(call));

        assertThat(storeCallStateService.statusOf(31L)).contains(StoreCallStatus.IN_PROGRESS);
    }
}
