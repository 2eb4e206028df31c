package com.phonos.commerce.repository;

import com.phonos.commerce.model.StoreCall;
import com.phonos.commerce.model.StoreCallStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface StoreCallRepository extends JpaRepository<StoreCall, Long> {

    List<StoreCall> findByTicketIdOrderByIdAsc(UUID ticketId);

    boolean existsByTicketId(UUID ticketId);

    Optional<StoreCall> findByProviderCallId(String providerCallId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select c from StoreCall c where c.id = :id")
    Optional<StoreCall> findByIdForUpdate(@Param("id") Long id);

    /**
     * Calls still unsettled whose last change is older than the cutoff; used by the timeout sweep.
     */
    @Query("select c.id from StoreCall c where c.status in :statuses and c.updatedAt < :cutoff")
    List<Long> findStaleCallIds(@Param("statuses") Collection<StoreCallStatus> statuses,
                                @Param("cutoff") OffsetDateTime cutoff);
}
