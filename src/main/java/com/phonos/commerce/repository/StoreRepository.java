package com.phonos.commerce.repository;

import com.phonos.commerce.model.Store;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface StoreRepository extends JpaRepository<Store, Long> {
    List<Store> findByTicketIdOrderByPriorityAscDiscoveryOrderAsc(UUID ticketId);

    long countByTicketId(UUID ticketId);
}
