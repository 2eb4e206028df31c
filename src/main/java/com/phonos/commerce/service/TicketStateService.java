package com.phonos.commerce.service;

import com.phonos.commerce.exception.ErrorCode;
import com.phonos.commerce.exception.TicketNotFoundException;
import com.phonos.commerce.exception.TicketStateConflictException;
import com.phonos.commerce.model.Ticket;
import com.phonos.commerce.model.TicketStatus;
import com.phonos.commerce.repository.TicketRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * The only component that writes ticket status. Every write locks the ticket row first, so
 * the pipeline, confirmation and any concurrent request see a single ordered history.
 */
@Service
public class TicketStateService {

    private static final Logger logger = LoggerFactory.getLogger(TicketStateService.class);

    private final TicketRepository ticketRepository;

    public TicketStateService(TicketRepository ticketRepository) {
        this.ticketRepository = ticketRepository;
    }

    /**
     * Persists a new ticket in {@link TicketStatus#RECEIVED} and hands its id to
     * {@code onCommit} once the row is visible to other transactions.
     */
    @Transactional
    public Ticket open(Ticket ticket, Consumer<UUID> onCommit) {
        Ticket saved = ticketRepository.save(ticket);
        UUID ticketId = saved.getId();
        logger.info("Ticket {} received: '{}' near '{}'", ticketId, saved.getQuery(), saved.getLocation());
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            onCommit.accept(ticketId);
            return saved;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                onCommit.accept(ticketId);
            }
        });
        return saved;
    }

    /**
     * Moves the ticket to {@code next}.
     *
     * @return false when the move would go backwards or leave a terminal status; nothing is written
     */
    @Transactional
    public boolean transition(UUID ticketId, TicketStatus next) {
        Ticket ticket = lock(ticketId);
        TicketStatus current = ticket.getStatus();
        if (!current.canTransitionTo(next)) {
            logger.warn("Ticket {}: refused status change {} -> {}", ticketId, current, next);
            return false;
        }
        ticket.setStatus(next);
        logger.info("Ticket {}: {} -> {}", ticketId, current, next);
        return true;
    }

    @Transactional
    public void setQueryType(UUID ticketId, String queryType) {
        lock(ticketId).setQueryType(queryType);
    }

    @Transactional
    public boolean fail(UUID ticketId, String errorMessage) {
        Ticket ticket = lock(ticketId);
        if (!ticket.getStatus().canTransitionTo(TicketStatus.FAILED)) {
            logger.warn("Ticket {}: not failing, already {} ({})", ticketId, ticket.getStatus(), errorMessage);
            return false;
        }
        ticket.setStatus(TicketStatus.FAILED);
        ticket.setErrorMessage(errorMessage);
        logger.warn("Ticket {} failed: {}", ticketId, errorMessage);
        return true;
    }

    @Transactional
    public boolean complete(UUID ticketId, Map<String, Object> result) {
        Ticket ticket = lock(ticketId);
        if (!ticket.getStatus().canTransitionTo(TicketStatus.COMPLETED)) {
            logger.warn("Ticket {}: not completing, already {}", ticketId, ticket.getStatus());
            return false;
        }
        ticket.setStatus(TicketStatus.COMPLETED);
        ticket.setFinalResult(result);
        logger.info("Ticket {} completed: {}", ticketId, result.get("status"));
        return true;
    }

    /**
     * Records the requester's choice. Commits on its own so that a booking failure afterwards
     * still leaves the ticket confirmed and a repeat confirm is refused.
     *
     * @throws TicketStateConflictException when the ticket is not completed or already confirmed
     */
    @Transactional
    public Ticket claimConfirmation(UUID ticketId, Long storeCallId) {
        Ticket ticket = lock(ticketId);
        if (ticket.getStatus() != TicketStatus.COMPLETED) {
            throw new TicketStateConflictException(ErrorCode.TICKET_NOT_COMPLETED,
                    "Ticket is " + ticket.getStatus().wireName() + ", options are not ready");
        }
        if (ticket.isConfirmed()) {
            throw new TicketStateConflictException(ErrorCode.TICKET_ALREADY_CONFIRMED,
                    "Ticket was already confirmed for store call " + ticket.getConfirmedStoreCallId());
        }
        ticket.setConfirmedStoreCallId(storeCallId);
        ticket.setConfirmedAt(OffsetDateTime.now());
        logger.info("Ticket {}: confirmed store call {}", ticketId, storeCallId);
        return ticket;
    }

    private Ticket lock(UUID ticketId) {
        return ticketRepository.findByIdForUpdate(ticketId)
                .orElseThrow(() -> new TicketNotFoundException(ticketId));
    }
}
