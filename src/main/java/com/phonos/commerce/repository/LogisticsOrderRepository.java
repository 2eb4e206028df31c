package com.phonos.commerce.repository;

import com.phonos.commerce.model.LogisticsOrder;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface LogisticsOrderRepository extends JpaRepository<LogisticsOrder, Long> {

    Optional<LogisticsOrder> findFirstByTicketIdAndSupersededFalseOrderByIdDesc(UUID ticketId);

    Optional<LogisticsOrder> findByProviderOrderId(String providerOrderId);

    List<LogisticsOrder> findByTicketIdOrderByIdAsc(UUID ticketId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select o from LogisticsOrder o where o.id = :id")
    Optional<LogisticsOrder> findByIdForUpdate(@Param("id") Long id);
}
