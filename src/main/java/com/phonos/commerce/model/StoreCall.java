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
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

/**
 * One outbound call to one store. Status only moves forward; see {@link StoreCallStatus}.
 */
@Entity
@Table(name = "store_calls")
@Getter
@Setter
@NoArgsConstructor
public class StoreCall {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "ticket_id", nullable = false, updatable = false)
    private UUID ticketId;

    @Column(name = "store_id", nullable = false, updatable = false)
    private Long storeId;

    @Column(name = "provider_call_id", unique = true)
    private String providerCallId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private StoreCallStatus status;

    @Column(name = "ended_reason")
    private String endedReason;

    @Column(name = "transcript", columnDefinition = "TEXT")
    private String transcript;

    @Column(name = "product_available")
    private Boolean productAvailable;

    @Column(name = "matched_product")
    private String matchedProduct;

    @Column(name = "price", precision = 12, scale = 2)
    private BigDecimal price;

    @Enumerated(EnumType.STRING)
    @Column(name = "match_type", length = 16)
    private MatchType matchType;

    @Column(name = "delivery_available")
    private Boolean deliveryAvailable;

    @Column(name = "delivery_eta")
    private String deliveryEta;

    @Column(name = "delivery_charge", precision = 12, scale = 2)
    private BigDecimal deliveryCharge;

    @Column(name = "delivery_mode")
    private String deliveryMode;

    @Column(name = "summary", columnDefinition = "TEXT")
    private String summary;

    @Column(name = "notes", columnDefinition = "TEXT")
    private String notes;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "analysis")
    private Map<String, Object> analysis;

    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    public StoreCall(UUID ticketId, Long storeId) {
        this.ticketId = ticketId;
        this.storeId = storeId;
        this.status = StoreCallStatus.QUEUED;
    }

    /**
     * Moves the call to {@code next} when that is a forward move.
     *
     * @return false when the transition was refused and nothing changed
     */
    public boolean advanceTo(StoreCallStatus next) {
        if (status == null || !status.canTransitionTo(next)) {
            return false;
        }
        this.status = next;
        return true;
    }

    public boolean isAvailableOption() {
        return status == StoreCallStatus.ANALYZED && Boolean.TRUE.equals(productAvailable);
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
