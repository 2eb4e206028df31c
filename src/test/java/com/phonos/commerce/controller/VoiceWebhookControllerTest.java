package com.phonos.commerce.controller;

import com.phonos.commerce.exception.GlobalExceptionHandler;
import com.phonos.commerce.model.VoiceEvent;
import com.phonos.commerce.service.StoreCallEventHandler;
import com.phonos.commerce.service.VoiceEventParser;
import com.phonos.commerce.service.WebhookEventDeduplicator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class VoiceWebhookControllerTest {

    private static final String RINGING = "{\"message\": {\"id\": \"m-1\", \"type\": \"status-update\", "
            + "\"status\": \"ringing\", \"call\": {\"id\": \"call-1\"}}}";

    @Mock
    private WebhookEventDeduplicator webhookEventDeduplicator;
    @Mock
    private StoreCallEventHandler storeCallEventHandler;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        VoiceWebhookController controller = new VoiceWebhookController(
                new VoiceEventParser(), webhookEventDeduplicator, storeCallEventHandler);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void statusUpdateIsHandledOnce() throws Exception {
        when(webhookEventDeduplicator.markFirstDelivery("m-1", "voice")).thenReturn(true).thenReturn(false);

        mockMvc.perform(post("/api/vapi/store-webhook").contentType(MediaType.APPLICATION_JSON).content(RINGING))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"));
        mockMvc.perform(post("/api/vapi/store-webhook").contentType(MediaType.APPLICATION_JSON).content(RINGING))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("duplicate"));

        verify(storeCallEventHandler, times(1)).handle(any(VoiceEvent.class));
    }

    @Test
    void failedHandlingReleasesEventSoRedeliveryIsProcessed() throws Exception {
        when(webhookEventDeduplicator.markFirstDelivery("m-1", "voice")).thenReturn(true);
        doThrow(new IllegalStateException("Store call 7 vanished"))
                .doNothing()
                .when(storeCallEventHandler).handle(any(VoiceEvent.class));

        mockMvc.perform(post("/api/vapi/store-webhook").contentType(MediaType.APPLICATION_JSON).content(RINGING))
                .andExpect(status().isInternalServerError());
        verify(webhookEventDeduplicator).release("m-1", "voice");

        mockMvc.perform(post("/api/vapi/store-webhook").contentType(MediaType.APPLICATION_JSON).content(RINGING))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"));
        verify(storeCallEventHandler, times(2)).handle(any(VoiceEvent.class));
    }

    @Test
    void unknownEventTypeIsIgnored() throws Exception {
        mockMvc.perform(post("/api/vapi/store-webhook").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\": {\"type\": \"speech-update\", \"call\": {\"id\": \"call-1\"}}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ignored"));

        verify(webhookEventDeduplicator, never()).markFirstDelivery(any(), any());
    }
}
