package com.phonos.commerce.service;

import com.phonos.commerce.exception.UpstreamProviderException;
import com.phonos.commerce.model.DeliveryQuote;
import com.phonos.commerce.model.DeliveryState;
import com.phonos.commerce.model.GeocodeResult;
import com.phonos.commerce.model.LogisticsCallbackEvent;
import com.phonos.commerce.model.LogisticsOrder;
import com.phonos.commerce.model.Product;
import com.phonos.commerce.model.Store;
import com.phonos.commerce.model.StoreCall;
import com.phonos.commerce.model.StoreCallStatus;
import com.phonos.commerce.model.Ticket;
import com.phonos.commerce.repository.LogisticsOrderRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LogisticsBookingServiceTest {

    private static final UUID TICKET_ID = UUID.randomUUID();
    private static final String CALLBACK = "https://commerce.example/api/logistics/callback";

    @Mock
    private GoogleMapsClient googleMapsClient;
    @Mock
    private ProRoutingClient proRoutingClient;
    @Mock
    private LogisticsOrderStateService logisticsOrderStateService;
    @Mock
    private LogisticsOrderRepository logisticsOrderRepository;

    private LogisticsBookingService bookingService;

    private final DeliveryQuote cheap = new DeliveryQuote("lsp-a", "Rapid Riders", new BigDecimal("35"), 10);
    private final DeliveryQuote pricey = new DeliveryQuote("lsp-b", "Metro Couriers", new BigDecimal("60"), 8);

    @BeforeEach
    void setUp() {
        bookingService = new LogisticsBookingService(googleMapsClient, proRoutingClient, logisticsOrderStateService,
                logisticsOrderRepository, Runnable::run, "https://commerce.example/", 2, BigDecimal.ZERO);
    }

    @Test
    void booksTheCheapestPartner() {
        when(logisticsOrderStateService.createPlacing(any(LogisticsOrder.class))).thenAnswer(invocation -> {
            LogisticsOrder draft = invocation.getArgument(0);
            draft.setId(9L);
            draft.setClientOrderId(TICKET_ID + "_x");
            return draft;
        });
        when(googleMapsClient.geocode("HSR Layout, Bengaluru")).thenReturn(Optional.of(
                new GeocodeResult(12.91, 77.64, "HSR Layout, Bengaluru, Karnataka 560102", "560102", "Bengaluru", "Karnataka")));
        when(proRoutingClient.getQuotes(any(LogisticsOrder.class)))
                .thenReturn(new ProRoutingClient.QuoteResult("q-1", List.of(pricey, cheap)));
        ProRoutingClient.CreatedOrder created = new ProRoutingClient.CreatedOrder("PR-1", "UnFulfilled", null);
        when(proRoutingClient.createOrder(any(LogisticsOrder.class), eq(cheap), eq("q-1"), eq(CALLBACK))).thenReturn(created);
        LogisticsOrder placed = new LogisticsOrder();
        placed.setState(DeliveryState.ORDER_PLACED);
        when(logisticsOrderStateService.markPlaced(9L, created, cheap, "q-1")).thenReturn(placed);

        LogisticsOrder result = bookingService.book(ticket(), storeCall(), store(), product(), "Asha");

        assertThat(result.getState()).isEqualTo(DeliveryState.ORDER_PLACED);
        ArgumentCaptor<LogisticsOrder> draft = ArgumentCaptor.forClass(LogisticsOrder.class);
        verify(logisticsOrderStateService).createPlacing(draft.capture());
        assertThat(draft.getValue().getOrderAmount()).isEqualByComparingTo("1499");
        assertThat(draft.getValue().getPickupPincode()).isEqualTo("560034");
        assertThat(draft.getValue().getDropPincode()).isEqualTo("560102");
        assertThat(draft.getValue().getCustomerName()).isEqualTo("Asha");
        verify(googleMapsClient, never()).reverseGeocode(anyDouble(), anyDouble());
    }

    @Test
    void geocodeFailureMarksTheOrderFailed() {
        when(logisticsOrderStateService.createPlacing(any(LogisticsOrder.class))).thenAnswer(invocation -> {
            LogisticsOrder draft = invocation.getArgument(0);
            draft.setId(9L);
            return draft;
        });
        when(googleMapsClient.geocode(anyString())).thenReturn(Optional.empty());

        assertThatThrownBy(() -> bookingService.book(ticket(), storeCall(), store(), product(), "Asha"))
                .isInstanceOf(UpstreamProviderException.class);
        verify(logisticsOrderStateService).markFailed(eq(9L), anyString());
        verifyNoInteractions(proRoutingClient);
    }

    @Test
    void callbackForUnknownOrderIsIgnored() {
        when(logisticsOrderRepository.findByProviderOrderId("PR-404")).thenReturn(Optional.empty());

        bookingService.handleCallback(event("PR-404", "Agent-assigned", false));

        verifyNoInteractions(logisticsOrderStateService);
    }

    @Test
    void ordinaryCallbackIsApplied() {
        LogisticsOrder order = currentOrder(1);
        when(logisticsOrderRepository.findByProviderOrderId("PR-1")).thenReturn(Optional.of(order));
        LogisticsCallbackEvent event = event("PR-1", "Agent-assigned", false);

        bookingService.handleCallback(event);

        verify(logisticsOrderStateService).applyCallback(1L, event);
    }

    @Test
    void partnerCancellationRebooksWithAnotherPartner() {
        LogisticsOrder order = currentOrder(1);
        LogisticsOrder next = new LogisticsOrder();
        next.setId(2L);
        next.setTicketId(TICKET_ID);
        next.setAttempt(2);
        next.setState(DeliveryState.PLACING_ORDER);
        LogisticsCallbackEvent event = event("PR-1", "Cancelled", true);
        when(logisticsOrderRepository.findByProviderOrderId("PR-1")).thenReturn(Optional.of(order));
        when(logisticsOrderRepository.findByTicketIdOrderByIdAsc(TICKET_ID)).thenReturn(List.of(order));
        when(logisticsOrderStateService.supersedeForRetry(1L, event)).thenReturn(Optional.of(next));
        when(proRoutingClient.getQuotes(next)).thenReturn(new ProRoutingClient.QuoteResult("q-2", List.of(cheap, pricey)));
        ProRoutingClient.CreatedOrder created = new ProRoutingClient.CreatedOrder("PR-2", "Pending", null);
        when(proRoutingClient.createOrder(next, pricey, "q-2", CALLBACK)).thenReturn(created);

        bookingService.handleCallback(event);

        verify(logisticsOrderStateService).markPlaced(2L, created, pricey, "q-2");
        verify(logisticsOrderStateService, never()).applyCallback(any(), any());
    }

    @Test
    void cancellationAfterRetriesAreUsedUpFailsTheDelivery() {
        LogisticsOrder order = currentOrder(3);
        LogisticsCallbackEvent event = event("PR-1", "Cancelled", true);
        when(logisticsOrderRepository.findByProviderOrderId("PR-1")).thenReturn(Optional.of(order));

        bookingService.handleCallback(event);

        verify(logisticsOrderStateService).applyCallback(1L, event);
        verify(logisticsOrderStateService, never()).supersedeForRetry(any(), any());
    }

    @Test
    void cheapestSkipsExcludedPartners() {
        assertThat(LogisticsBookingService.cheapest(List.of(cheap, pricey), Set.of())).contains(cheap);
        assertThat(LogisticsBookingService.cheapest(List.of(cheap, pricey), Set.of("lsp-a"))).contains(pricey);
        assertThat(LogisticsBookingService.cheapest(List.of(cheap), Set.of("lsp-a"))).isEmpty();
    }

    private static LogisticsOrder currentOrder(int attempt) {
        LogisticsOrder order = new LogisticsOrder();
        order.setId(1L);
        order.setTicketId(TICKET_ID);
        order.setProviderOrderId("PR-1");
        order.setLspId("lsp-a");
        order.setLspName("Rapid Riders");
        order.setState(DeliveryState.AGENT_ASSIGNED);
        order.setAttempt(attempt);
        return order;
    }

    private static LogisticsCallbackEvent event(String orderId, String state, boolean cancelledByPartner) {
        return new LogisticsCallbackEvent(orderId + ":" + state, orderId, state, null, null, null,
                cancelledByPartner, cancelledByPartner ? "Rider unavailable" : null);
    }

    private static Ticket ticket() {
        Ticket ticket = new Ticket("a 20W USB-C charger", "HSR Layout, Bengaluru", "+919800000000", "Asha", 4);
        ticket.setId(TICKET_ID);
        return ticket;
    }

    private static StoreCall storeCall() {
        StoreCall call = new StoreCall(TICKET_ID, 5L);
        call.setId(55L);
        call.setStatus(StoreCallStatus.ANALYZED);
        call.setProductAvailable(true);
        call.setMatchedProduct("Anker 20W");
        call.setPrice(new BigDecimal("1499"));
        return call;
    }

    private static Store store() {
        return Store.builder()
                .id(5L)
                .ticketId(TICKET_ID)
                .name("Alpha Mobiles")
                .address("80 Feet Road, Koramangala, Bengaluru, Karnataka 560034")
                .phoneNumber("+91 98450 12345")
                .latitude(12.93)
                .longitude(77.62)
                .build();
    }

    private static Product product() {
        return Product.builder().ticketId(TICKET_ID).productName("20W USB-C charger").build();
    }
}
