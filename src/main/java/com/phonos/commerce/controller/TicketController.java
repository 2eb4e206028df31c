package com.phonos.commerce.controller;

import com.phonos.commerce.dto.ConfirmRequest;
import com.phonos.commerce.dto.ConfirmResponse;
import com.phonos.commerce.dto.CreateTicketRequest;
import com.phonos.commerce.dto.CreateTicketResponse;
import com.phonos.commerce.dto.DeliveryResponse;
import com.phonos.commerce.dto.OptionsResponse;
import com.phonos.commerce.dto.TicketStatusResponse;
import com.phonos.commerce.service.TicketOrchestratorService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/ticket")
@Tag(name = "Tickets", description = "Create product requests, follow them, pick an option and track delivery")
public class TicketController {

    private final TicketOrchestratorService ticketOrchestratorService;

    public TicketController(TicketOrchestratorService ticketOrchestratorService) {
        this.ticketOrchestratorService = ticketOrchestratorService;
    }

    @Operation(
            summary = "Create a ticket",
            description = "Classifies the request and, for product orders, starts calling nearby stores in the background."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Ticket accepted, or request rejected after classification"),
            @ApiResponse(responseCode = "400", description = "Missing query, location or phone, or max_stores out of range")
    })
    @PostMapping
    public ResponseEntity<CreateTicketResponse> createTicket(@RequestBody CreateTicketRequest request) {
        return ResponseEntity.ok(ticketOrchestratorService.create(request));
    }

    @Operation(summary = "Get ticket status", description = "Snapshot of the pipeline, store calls, online deals and delivery.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Snapshot returned"),
            @ApiResponse(responseCode = "404", description = "Unknown ticket")
    })
    @GetMapping("/{ticketId}")
    public ResponseEntity<TicketStatusResponse> getTicket(
            @Parameter(description = "Ticket ID", required = true) @PathVariable UUID ticketId) {
        return ResponseEntity.ok(ticketOrchestratorService.getStatus(ticketId));
    }

    @Operation(summary = "Get ranked options", description = "Available store offers first, then online deals.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Options returned"),
            @ApiResponse(responseCode = "404", description = "Unknown ticket"),
            @ApiResponse(responseCode = "409", description = "Ticket has not completed")
    })
    @GetMapping("/{ticketId}/options")
    public ResponseEntity<OptionsResponse> getOptions(
            @Parameter(description = "Ticket ID", required = true) @PathVariable UUID ticketId) {
        return ResponseEntity.ok(ticketOrchestratorService.getOptions(ticketId));
    }

    @Operation(summary = "Confirm an option", description = "Accepts one store offer and books delivery from that store.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Delivery booked"),
            @ApiResponse(responseCode = "400", description = "Missing store call or customer name"),
            @ApiResponse(responseCode = "404", description = "Unknown ticket or store call"),
            @ApiResponse(responseCode = "409", description = "Ticket not completed, already confirmed, or product unavailable"),
            @ApiResponse(responseCode = "502", description = "Delivery booking failed")
    })
    @PostMapping("/{ticketId}/confirm")
    public ResponseEntity<ConfirmResponse> confirm(
            @Parameter(description = "Ticket ID", required = true) @PathVariable UUID ticketId,
            @RequestBody ConfirmRequest request) {
        return ResponseEntity.ok(ticketOrchestratorService.confirm(ticketId, request));
    }

    @Operation(summary = "Get delivery", description = "Current delivery order for a confirmed ticket.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Delivery returned"),
            @ApiResponse(responseCode = "404", description = "Unknown ticket or no delivery yet")
    })
    @GetMapping("/{ticketId}/delivery")
    public ResponseEntity<DeliveryResponse> getDelivery(
            @Parameter(description = "Ticket ID", required = true) @PathVariable UUID ticketId) {
        return ResponseEntity.ok(ticketOrchestratorService.getDelivery(ticketId));
    }
}
