package com.phonos.commerce.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * The researched product for a ticket. Written once when research completes.
 */
@Entity
@Table(name = "products")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Product {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "ticket_id", nullable = false, unique = true, updatable = false)
    private UUID ticketId;

    @Column(name = "product_name", nullable = false)
    private String productName;

    @Column(name = "product_category")
    private String productCategory;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "specs")
    private Map<String, Object> specs;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "alternatives")
    private List<ProductAlternative> alternatives;

    @Column(name = "avg_price_online", precision = 12, scale = 2)
    private BigDecimal avgPriceOnline;

    @Column(name = "store_search_query")
    private String storeSearchQuery;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "search_queries")
    private List<String> searchQueries;

    @Column(name = "specific_store")
    private boolean specificStore;

    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = OffsetDateTime.now();
        }
    }
}
