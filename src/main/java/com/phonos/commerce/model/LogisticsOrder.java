package com.phonos.commerce.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Delivery booked for a confirmed ticket. A partner cancellation supersedes the row and a
 * fresh one is created for the next attempt, so at most one non-superseded row exists per ticket.
 */
@Entity
@Table(name = "logistics_orders")
@Getter
@Setter
@NoArgsConstructor
public class LogisticsOrder {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "ticket_id", nullable = false, updatable = false)
    private UUID ticketId;

    @Column(name = "store_call_id", nullable = false, updatable = false)
    private Long storeCallId;

    @Column(name = "client_order_id", nullable = false, unique = true, updatable = false)
    private String clientOrderId;

    @Column(name = "provider_order_id", unique = true)
    private String providerOrderId;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false, length = 32)
    private DeliveryState state;

    @Column(name = "provider_state")
    private String providerState;

    @Column(name = "pickup_address", columnDefinition = "TEXT")
    private String pickupAddress;

    @Column(name = "pickup_lat")
    private Double pickupLat;

    @Column(name = "pickup_lng")
    private Double pickupLng;

    @Column(name = "pickup_pincode", length = 16)
    private String pickupPincode;

    @Column(name = "pickup_phone")
    private String pickupPhone;

    @Column(name = "pickup_store_name")
    private String pickupStoreName;

    @Column(name = "drop_address", columnDefinition = "TEXT")
    private String dropAddress;

    @Column(name = "drop_lat")
    private Double dropLat;

    @Column(name = "drop_lng")
    private Double dropLng;

    @Column(name = "drop_pincode", length = 16)
    private String dropPincode;

    @Column(name = "drop_city")
    private String dropCity;

    @Column(name = "drop_state")
    private String dropState;

    @Column(name = "drop_phone")
    private String dropPhone;

    @Column(name = "customer_name")
    private String customerName;

    @Column(name = "item_name")
    private String itemName;

    @Column(name = "order_amount", precision = 12, scale = 2)
    private BigDecimal orderAmount;

    @Column(name = "quote_id")
    private String quoteId;

    @Column(name = "lsp_id")
    private String lspId;

    @Column(name = "lsp_name")
    private String lspName;

    @Column(name = "quoted_price", precision = 12, scale = 2)
    private BigDecimal quotedPrice;

    @Column(name = "rider_name")
    private String riderName;

    @Column(name = "rider_phone")
    private String riderPhone;

    @Column(name = "tracking_url", columnDefinition = "TEXT")
    private String trackingUrl;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "superseded", nullable = false)
    private boolean superseded;

    @Column(name = "attempt", nullable = false)
    private int attempt = 1;

    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    public boolean advanceTo(DeliveryState next) {
        if (state == null || !state.canTransitionTo(next)) {
            return false;
        }
        this.state = next;
        return true;
    }

    @PrePersist
    void onCreate() {
        OffsetDateTime now = OffsetDateTime.now();
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = OffsetDateTime.now();
    }
}
