package com.phonos.commerce.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.phonos.commerce.model.VoiceEvent;
import com.phonos.commerce.service.StoreCallEventHandler;
import com.phonos.commerce.service.VoiceEventParser;
import com.phonos.commerce.service.WebhookEventDeduplicator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api/vapi")
@Tag(name = "Webhooks")
public class VoiceWebhookController {

    private static final Logger logger = LoggerFactory.getLogger(VoiceWebhookController.class);
    static final String SOURCE = "voice";

    private final VoiceEventParser voiceEventParser;
    private final WebhookEventDeduplicator webhookEventDeduplicator;
    private final StoreCallEventHandler storeCallEventHandler;

    public VoiceWebhookController(VoiceEventParser voiceEventParser,
                                  WebhookEventDeduplicator webhookEventDeduplicator,
                                  StoreCallEventHandler storeCallEventHandler) {
        this.voiceEventParser = voiceEventParser;
        this.webhookEventDeduplicator = webhookEventDeduplicator;
        this.storeCallEventHandler = storeCallEventHandler;
    }

    /**
     * Acknowledges ignored and duplicate events. When handling fails the event id is released
     * and the error surfaces, so the provider redelivers the event.
     */
    @Operation(summary = "Voice provider events", description = "Call status updates and end-of-call reports for store calls.")
    @PostMapping("/store-webhook")
    public ResponseEntity<Map<String, String>> storeWebhook(@RequestBody JsonNode body) {
        Optional<VoiceEvent> parsed = voiceEventParser.parse(body);
        if (parsed.isEmpty()) {
            return ResponseEntity.ok(Map.of("status", "ignored"));
        }
        VoiceEvent event = parsed.get();
        if (!webhookEventDeduplicator.markFirstDelivery(event.eventId(), SOURCE)) {
            logger.debug("Duplicate voice event {}", event.eventId());
            return ResponseEntity.ok(Map.of("status", "duplicate"));
        }
        try {
            storeCallEventHandler.handle(event);
        } catch (RuntimeException e) {
            webhookEventDeduplicator.release(event.eventId(), SOURCE);
            throw e;
        }
        return ResponseEntity.ok(Map.of("status", "ok"));
    }
}
