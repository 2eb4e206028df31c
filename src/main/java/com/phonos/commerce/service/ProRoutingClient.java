package com.phonos.commerce.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.phonos.commerce.exception.ErrorCode;
import com.phonos.commerce.exception.ProviderTimeoutException;
import com.phonos.commerce.exception.UpstreamProviderException;
import com.phonos.commerce.model.DeliveryQuote;
import com.phonos.commerce.model.LogisticsOrder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.math.BigDecimal;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * ProRouting partner API: delivery quotes and asynchronous order creation.
 */
@Component
public class ProRoutingClient {

    private static final Logger logger = LoggerFactory.getLogger(ProRoutingClient.class);
    private static final DateTimeFormatter PROMISED_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final RestClient logisticsRestClient;
    private final ObjectMapper objectMapper;
    private final String orderCategory;
    private final String searchCategory;
    private final int promisedMinutes;
    private final ZoneId zoneId;

    public ProRoutingClient(@Qualifier("logisticsRestClient") RestClient logisticsRestClient,
                            ObjectMapper objectMapper,
                            @Value("${app.logistics.order-category:F&B}") String orderCategory,
                            @Value("${app.logistics.search-category:Immediate Delivery}") String searchCategory,
                            @Value("${app.logistics.promised-minutes:60}") int promisedMinutes,
                            @Value("${app.logistics.zone:Asia/Kolkata}") String zone) {
        this.logisticsRestClient = logisticsRestClient;
        this.objectMapper = objectMapper;
        this.orderCategory = orderCategory;
        this.searchCategory = searchCategory;
        this.promisedMinutes = promisedMinutes;
        this.zoneId = ZoneId.of(zone);
    }

    public QuoteResult getQuotes(LogisticsOrder order) {
        ObjectNode payload = objectMapper.createObjectNode();
        ObjectNode pickup = payload.putObject("pickup");
        pickup.put("lat", order.getPickupLat());
        pickup.put("lng", order.getPickupLng());
        pickup.put("pincode", order.getPickupPincode());
        ObjectNode drop = payload.putObject("drop");
        drop.put("lat", order.getDropLat());
        drop.put("lng", order.getDropLng());
        drop.put("pincode", order.getDropPincode());
        payload.put("city", order.getDropCity());
        payload.put("order_category", orderCategory);
        payload.put("search_category", searchCategory);
        payload.put("order_amount", order.getOrderAmount());
        payload.put("cod_amount", 0);
        payload.put("order_weight", 1.0);

        JsonNode data = post("/partner/quotes", payload);
        if (data.path("status").asInt(0) != 1) {
            throw new UpstreamProviderException(ErrorCode.LOGISTICS_ERROR,
                    data.path("message").asText("No delivery partners available for this route"));
        }
        List<DeliveryQuote> quotes = new ArrayList<>();
        for (JsonNode quote : data.path("quotes")) {
            String lspId = JsonNodes.textOrNull(quote.path("lsp_id"));
            BigDecimal price = JsonNodes.decimalOrNull(quote.path("price_forward"));
            if (lspId == null || price == null) {
                continue;
            }
            quotes.add(new DeliveryQuote(lspId, JsonNodes.textOrNull(quote.path("logistics_seller")), price,
                    JsonNodes.intOrNull(quote.path("pickup_eta"))));
        }
        logger.info("ProRouting quotes for {}: {} partners", order.getClientOrderId(), quotes.size());
        return new QuoteResult(JsonNodes.textOrNull(data.path("quote_id")), quotes);
    }

    public CreatedOrder createOrder(LogisticsOrder order, DeliveryQuote quote, String quoteId, String callbackUrl) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("client_order_id", order.getClientOrderId());
        payload.put("retail_order_id", order.getClientOrderId());
        payload.set("pickup", location(order.getPickupLat(), order.getPickupLng(), order.getPickupPincode(),
                order.getPickupStoreName(), order.getPickupAddress(), order.getDropCity(), order.getDropState(),
                order.getPickupPhone()));
        payload.set("drop", location(order.getDropLat(), order.getDropLng(), order.getDropPincode(),
                order.getCustomerName(), order.getDropAddress(), order.getDropCity(), order.getDropState(),
                order.getDropPhone()));
        payload.put("customer_promised_time",
                ZonedDateTime.now(zoneId).plusMinutes(promisedMinutes).format(PROMISED_TIME));
        payload.put("callback_url", callbackUrl);
        payload.put("order_category", orderCategory);
        payload.put("search_category", searchCategory);
        payload.put("order_amount", order.getOrderAmount());
        payload.put("cod_amount", 0);
        payload.put("order_weight", 1.0);
        ObjectNode item = payload.putArray("order_items").addObject();
        item.put("name", order.getItemName());
        item.put("qty", 1);
        item.put("price", order.getOrderAmount());
        payload.put("order_ready", true);
        ObjectNode criteria = payload.putObject("select_criteria");
        criteria.put("mode", "selected_lsp");
        criteria.put("lsp_id", quote.lspId());
        if (quoteId != null) {
            criteria.put("quote_id", quoteId);
        }

        JsonNode data = post("/partner/order/createasync", payload);
        if (data.path("status").asInt(0) != 1) {
            throw new UpstreamProviderException(ErrorCode.LOGISTICS_ERROR,
                    data.path("message").asText("Order creation failed"));
        }
        JsonNode created = data.path("order");
        String providerOrderId = JsonNodes.textOrNull(created.path("id"));
        if (providerOrderId == null) {
            throw new UpstreamProviderException(ErrorCode.LOGISTICS_ERROR, "Order creation returned no order id");
        }
        String state = JsonNodes.textOrNull(created.path("state"));
        return new CreatedOrder(providerOrderId, state != null ? state : "UnFulfilled",
                JsonNodes.textOrNull(created.path("tracking_url")));
    }

    private ObjectNode location(Double lat, Double lng, String pincode, String name, String line1,
                                String city, String state, String phone) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("lat", lat);
        node.put("lng", lng);
        ObjectNode address = node.putObject("address");
        address.put("name", name);
        address.put("line1", line1);
        address.put("line2", "");
        address.put("city", city);
        address.put("state", state);
        node.put("pincode", pincode);
        node.put("phone", phone == null ? "" : phone.replaceAll("[^0-9]", ""));
        return node;
    }

    private JsonNode post(String path, ObjectNode payload) {
        try {
            JsonNode body = logisticsRestClient.post()
                    .uri(path)
                    .body(payload)
                    .retrieve()
                    .body(JsonNode.class);
            if (body == null) {
                throw new UpstreamProviderException(ErrorCode.LOGISTICS_ERROR, "Empty response from " + path);
            }
            return body;
        } catch (ResourceAccessException e) {
            if (e.getCause() instanceof HttpTimeoutException || e.getCause() instanceof SocketTimeoutException) {
                throw new ProviderTimeoutException("ProRouting " + path + " timed out", e);
            }
            throw new UpstreamProviderException(ErrorCode.LOGISTICS_ERROR, "ProRouting " + path + " unreachable", e);
        } catch (RestClientException e) {
            throw new UpstreamProviderException(ErrorCode.LOGISTICS_ERROR,
                    "ProRouting " + path + " failed: " + e.getMessage(), e);
        }
    }

    public record QuoteResult(String quoteId, List<DeliveryQuote> quotes) {
    }

    public record CreatedOrder(String providerOrderId, String providerState, String trackingUrl) {
    }
}
