package com.phonos.commerce.controller;

import com.phonos.commerce.exception.GlobalExceptionHandler;
import com.phonos.commerce.model.LogisticsCallbackEvent;
import com.phonos.commerce.service.LogisticsBookingService;
import com.phonos.commerce.service.LogisticsCallbackParser;
import com.phonos.commerce.service.WebhookEventDeduplicator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class LogisticsCallbackControllerTest {

    private static final String BODY = "{\"order\":{\"id\":\"PR-1\",\"state\":\"Agent-assigned\"}}";

    @Mock
    private WebhookEventDeduplicator webhookEventDeduplicator;
    @Mock
    private LogisticsBookingService logisticsBookingService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        LogisticsCallbackController controller = new LogisticsCallbackController(
                new LogisticsCallbackParser(), webhookEventDeduplicator, logisticsBookingService);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void firstDeliveryIsHandled() throws Exception {
        when(webhookEventDeduplicator.markFirstDelivery(any(), any())).thenReturn(true);

        mockMvc.perform(post("/api/logistics/callback").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"));

        verify(logisticsBookingService).handleCallback(any(LogisticsCallbackEvent.class));
    }

    @Test
    void duplicateIsAcknowledgedButNotHandled() throws Exception {
        when(webhookEventDeduplicator.markFirstDelivery(any(), any())).thenReturn(false);

        mockMvc.perform(post("/api/logistics/callback").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("duplicate"));

        verify(logisticsBookingService, never()).handleCallback(any());
    }

    @Test
    void failedHandlingReleasesEventSoRedeliveryIsProcessed() throws Exception {
        when(webhookEventDeduplicator.markFirstDelivery("PR-1:Agent-assigned:null", "logistics")).thenReturn(true);
        doThrow(new CannotAcquireLockException("lock timeout"))
                .doNothing()
                .when(logisticsBookingService).handleCallback(any(LogisticsCallbackEvent.class));

        mockMvc.perform(post("/api/logistics/callback").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isInternalServerError());
        verify(webhookEventDeduplicator).release("PR-1:Agent-assigned:null", "logistics");

        mockMvc.perform(post("/api/logistics/callback").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"));
        verify(logisticsBookingService, times(2)).handleCallback(any(LogisticsCallbackEvent.class));
    }

    @Test
    void bodyWithoutOrderIsIgnored() throws Exception {
        mockMvc.perform(post("/api/logistics/callback").contentType(MediaType.APPLICATION_JSON).content("{\"ping\":true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ignored"));

        verifyNoInteractions(webhookEventDeduplicator, logisticsBookingService);
    }
}
