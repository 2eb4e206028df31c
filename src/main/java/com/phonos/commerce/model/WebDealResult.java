package com.phonos.commerce.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "web_deal_results")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebDealResult {

    @Id
    @Column(name = "ticket_id", nullable = false, updatable = false)
    private UUID ticketId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private WebDealStatus status;

    @Column(name = "search_summary", columnDefinition = "TEXT")
    private String searchSummary;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "deals")
    private List<WebDeal> deals;

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;
}
