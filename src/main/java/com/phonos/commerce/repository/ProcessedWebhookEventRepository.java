package com.phonos.commerce.repository;

import com.phonos.commerce.model.ProcessedWebhookEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;

@Repository
public interface ProcessedWebhookEventRepository extends JpaRepository<ProcessedWebhookEvent, String> {

    @Modifying
    @Transactional
    @Query("delete from ProcessedWebhookEvent e where e.receivedAt < :cutoff")
    int deleteReceivedBefore(@Param("cutoff") OffsetDateTime cutoff);
}
