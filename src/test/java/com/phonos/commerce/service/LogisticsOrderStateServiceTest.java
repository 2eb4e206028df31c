package com.phonos.commerce.service;

import com.phonos.commerce.model.DeliveryQuote;
import com.phonos.commerce.model.DeliveryState;
import com.phonos.commerce.model.LogisticsCallbackEvent;
import com.phonos.commerce.model.LogisticsOrder;
import com.phonos.commerce.repository.LogisticsOrderRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LogisticsOrderStateServiceTest {

    private static final UUID TICKET_ID = UUID.randomUUID();

    @Mock
    private LogisticsOrderRepository logisticsOrderRepository;

    private LogisticsOrderStateService logisticsOrderStateService;

    private LogisticsOrder order;

    @BeforeEach
    void setUp() {
        logisticsOrderStateService = new LogisticsOrderStateService(logisticsOrderRepository);
        order = new LogisticsOrder();
        order.setId(7L);
        order.setTicketId(TICKET_ID);
        order.setStoreCallId(11L);
        order.setClientOrderId(TICKET_ID + "_abc");
        order.setProviderOrderId("PR-7");
        order.setState(DeliveryState.ORDER_PLACED);
        order.setLspId("lsp-a");
    }

    @Test
    void deliveredThenLateOrderPlacedStaysDelivered() {
        when(logisticsOrderRepository.findByIdForUpdate(7L)).thenReturn(Optional.of(order));

        logisticsOrderStateService.applyCallback(7L, callback("Order-delivered", null));
        LogisticsOrder after = logisticsOrderStateService.applyCallback(7L, callback("Searching-for-Agent", null));

        assertThat(after.getState()).isEqualTo(DeliveryState.DELIVERED);
        assertThat(after.getProviderState()).isEqualTo("Order-delivered");
    }

    @Test
    void riderDetailsMergeEvenWhenStateDoesNotMove() {
        order.setState(DeliveryState.AGENT_ASSIGNED);
        when(logisticsOrderRepository.findByIdForUpdate(7L)).thenReturn(Optional.of(order));

        LogisticsOrder after = logisticsOrderStateService.applyCallback(7L, callback("At-pickup", "Ravi"));

        assertThat(after.getState()).isEqualTo(DeliveryState.AGENT_ASSIGNED);
        assertThat(after.getRiderName()).isEqualTo("Ravi");
        assertThat(after.getTrackingUrl()).isEqualTo("https://track.example/PR-7");
    }

    @Test
    void createPlacingAssignsClientOrderId() {
        LogisticsOrder draft = new LogisticsOrder();
        draft.setTicketId(TICKET_ID);
        when(logisticsOrderRepository.save(any(LogisticsOrder.class))).thenAnswer(invocation -> invocation.getArgument(0));

        LogisticsOrder created = logisticsOrderStateService.createPlacing(draft);

        assertThat(created.getState()).isEqualTo(DeliveryState.PLACING_ORDER);
        assertThat(created.getClientOrderId()).startsWith(TICKET_ID + "_");
    }

    @Test
    void markPlacedRecordsQuoteAndProviderOrder() {
        order.setState(DeliveryState.PLACING_ORDER);
        when(logisticsOrderRepository.findByIdForUpdate(7L)).thenReturn(Optional.of(order));

        LogisticsOrder placed = logisticsOrderStateService.markPlaced(7L,
                new ProRoutingClient.CreatedOrder("PR-8", "UnFulfilled", "https://track.example/PR-8"),
                new DeliveryQuote("lsp-b", "Rapid Riders", new BigDecimal("45"), 12), "q-1");

        assertThat(placed.getState()).isEqualTo(DeliveryState.ORDER_PLACED);
        assertThat(placed.getProviderOrderId()).isEqualTo("PR-8");
        assertThat(placed.getLspName()).isEqualTo("Rapid Riders");
        assertThat(placed.getQuotedPrice()).isEqualByComparingTo("45");
        assertThat(placed.getQuoteId()).isEqualTo("q-1");
    }

    @Test
    void supersedeRetiresOrderAndOpensNextAttempt() {
        order.setDropAddress("HSR Layout, Bengaluru");
        order.setPickupStoreName("Alpha Mobiles");
        when(logisticsOrderRepository.findByIdForUpdate(7L)).thenReturn(Optional.of(order));
        when(logisticsOrderRepository.save(any(LogisticsOrder.class))).thenAnswer(invocation -> invocation.getArgument(0));

        Optional<LogisticsOrder> next = logisticsOrderStateService.supersedeForRetry(7L,
                new LogisticsCallbackEvent("cb-1", "PR-7", "Cancelled", null, null, null, true, "Rider unavailable"));

        assertThat(order.isSuperseded()).isTrue();
        assertThat(order.getState()).isEqualTo(DeliveryState.DELIVERY_FAILED);
        assertThat(next).isPresent();
        assertThat(next.get().getAttempt()).isEqualTo(2);
        assertThat(next.get().getState()).isEqualTo(DeliveryState.PLACING_ORDER);
        assertThat(next.get().getDropAddress()).isEqualTo("HSR Layout, Bengaluru");
        assertThat(next.get().getClientOrderId()).isNotEqualTo(order.getClientOrderId());
    }

    @Test
    void terminalOrderIsNotSuperseded() {
        order.setState(DeliveryState.DELIVERED);
        when(logisticsOrderRepository.findByIdForUpdate(7L)).thenReturn(Optional.of(order));

        assertThat(logisticsOrderStateService.supersedeForRetry(7L,
                new LogisticsCallbackEvent("cb-2", "PR-7", "Cancelled", null, null, null, true, null))).isEmpty();
    }

    private static LogisticsCallbackEvent callback(String state, String riderName) {
        return new LogisticsCallbackEvent("PR-7:" + state, "PR-7", state, riderName, null,
                "https://track.example/PR-7", false, null);
    }
}
