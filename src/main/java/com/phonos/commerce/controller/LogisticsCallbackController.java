package com.phonos.commerce.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.phonos.commerce.model.LogisticsCallbackEvent;
import com.phonos.commerce.service.LogisticsBookingService;
import com.phonos.commerce.service.LogisticsCallbackParser;
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
@RequestMapping("/api/logistics")
@Tag(name = "Webhooks")
public class LogisticsCallbackController {

    private static final Logger logger = LoggerFactory.getLogger(LogisticsCallbackController.class);
    static final String SOURCE = "logistics";

    private final LogisticsCallbackParser logisticsCallbackParser;
    private final WebhookEventDeduplicator webhookEventDeduplicator;
    private final LogisticsBookingService logisticsBookingService;

    public LogisticsCallbackController(LogisticsCallbackParser logisticsCallbackParser,
                                       WebhookEventDeduplicator webhookEventDeduplicator,
                                       LogisticsBookingService logisticsBookingService) {
        this.logisticsCallbackParser = logisticsCallbackParser;
        this.webhookEventDeduplicator = webhookEventDeduplicator;
        this.logisticsBookingService = logisticsBookingService;
    }

    @Operation(summary = "Logistics provider callbacks", description = "Order state, rider and tracking updates for deliveries.")
    @PostMapping("/callback")
    public ResponseEntity<Map<String, String>> callback(@RequestBody JsonNode body) {
        Optional<LogisticsCallbackEvent> parsed = logisticsCallbackParser.parse(body);
        if (parsed.isEmpty()) {
            logger.warn("Unreadable logistics callback: {}", body);
            return ResponseEntity.ok(Map.of("status", "ignored"));
        }
        LogisticsCallbackEvent event = parsed.get();
        if (!webhookEventDeduplicator.markFirstDelivery(event.eventId(), SOURCE)) {
            logger.debug("Duplicate logistics callback {}", event.eventId());
            return ResponseEntity.ok(Map.of("status", "duplicate"));
        }
        logger.info("Logistics callback for order {}: {}", event.providerOrderId(), event.providerState());
        try {
            logisticsBookingService.handleCallback(event);
        } catch (RuntimeException e) {
            webhookEventDeduplicator.release(event.eventId(), SOURCE);
            throw e;
        }
        return ResponseEntity.ok(Map.of("status", "ok"));
    }
}
