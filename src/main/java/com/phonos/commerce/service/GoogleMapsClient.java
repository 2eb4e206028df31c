package com.phonos.commerce.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.phonos.commerce.exception.ErrorCode;
import com.phonos.commerce.exception.UpstreamProviderException;
import com.phonos.commerce.model.GeocodeResult;
import com.phonos.commerce.model.StoreCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Google Places text search, place details and geocoding.
 */
@Component
public class GoogleMapsClient {

    private static final Logger logger = LoggerFactory.getLogger(GoogleMapsClient.class);
    private static final Pattern PINCODE = Pattern.compile("\\b[1-9]\\d{5}\\b");
    private static final String DETAIL_FIELDS =
            "formatted_phone_number,international_phone_number,name,rating,user_ratings_total,formatted_address,geometry";

    private final RestClient mapsRestClient;
    private final String apiKey;
    private final String region;

    public GoogleMapsClient(@Qualifier("mapsRestClient") RestClient mapsRestClient,
                            @Value("${app.maps.api-key:}") String apiKey,
                            @Value("${app.maps.region:in}") String region) {
        this.mapsRestClient = mapsRestClient;
        this.apiKey = apiKey;
        this.region = region;
    }

    /**
     * Runs a text search and resolves each hit's details. Results keep the provider's order.
     */
    public List<StoreCandidate> searchStores(String searchText, int limit) {
        JsonNode data = get("/place/textsearch/json?query={query}&key={key}", searchText, apiKey);
        String status = data.path("status").asText("");
        if ("ZERO_RESULTS".equals(status)) {
            return List.of();
        }
        if (!"OK".equals(status)) {
            throw new UpstreamProviderException(ErrorCode.MAPS_ERROR,
                    "Places text search failed: " + status + " " + data.path("error_message").asText(""));
        }

        List<StoreCandidate> candidates = new ArrayList<>();
        for (JsonNode place : data.path("results")) {
            if (candidates.size() >= limit) {
                break;
            }
            String placeId = JsonNodes.textOrNull(place.path("place_id"));
            if (placeId == null) {
                continue;
            }
            candidates.add(resolveDetails(placeId, place));
        }
        return candidates;
    }

    public Optional<GeocodeResult> geocode(String address) {
        JsonNode data = get("/geocode/json?address={address}&region={region}&key={key}", address, region, apiKey);
        return firstResult(data, address);
    }

    public Optional<GeocodeResult> reverseGeocode(double latitude, double longitude) {
        JsonNode data = get("/geocode/json?latlng={latlng}&key={key}", latitude + "," + longitude, apiKey);
        return firstResult(data, latitude + "," + longitude);
    }

    public static Optional<String> extractPincode(String address) {
        if (address == null) {
            return Optional.empty();
        }
        Matcher matcher = PINCODE.matcher(address);
        return matcher.find() ? Optional.of(matcher.group()) : Optional.empty();
    }

    private StoreCandidate resolveDetails(String placeId, JsonNode place) {
        JsonNode detail;
        try {
            detail = get("/place/details/json?place_id={placeId}&fields={fields}&key={key}",
                    placeId, DETAIL_FIELDS, apiKey).path("result");
        } catch (UpstreamProviderException e) {
            logger.warn("Place details failed for {}: {}", placeId, e.getMessage());
            detail = place;
        }
        String phone = JsonNodes.textOrNull(detail.path("international_phone_number"));
        if (phone == null) {
            phone = JsonNodes.textOrNull(detail.path("formatted_phone_number"));
        }
        JsonNode location = detail.path("geometry").path("location");
        if (location.isMissingNode()) {
            location = place.path("geometry").path("location");
        }
        return new StoreCandidate(
                placeId,
                firstText(detail.path("name"), place.path("name"), "Unknown"),
                firstText(detail.path("formatted_address"), place.path("formatted_address"), null),
                phone,
                JsonNodes.doubleOrNull(detail.has("rating") ? detail.path("rating") : place.path("rating")),
                JsonNodes.intOrNull(detail.has("user_ratings_total")
                        ? detail.path("user_ratings_total") : place.path("user_ratings_total")),
                JsonNodes.doubleOrNull(location.path("lat")),
                JsonNodes.doubleOrNull(location.path("lng")));
    }

    private Optional<GeocodeResult> firstResult(JsonNode data, String input) {
        JsonNode results = data.path("results");
        if (!results.isArray() || results.isEmpty()) {
            logger.warn("Geocoding returned no results for {} (status={})", input, data.path("status").asText(""));
            return Optional.empty();
        }
        JsonNode top = results.get(0);
        JsonNode location = top.path("geometry").path("location");
        if (!location.has("lat") || !location.has("lng")) {
            return Optional.empty();
        }
        String pincode = null;
        String city = null;
        String state = null;
        for (JsonNode component : top.path("address_components")) {
            List<String> types = JsonNodes.readArray(component.path("types"));
            String name = JsonNodes.textOrNull(component.path("long_name"));
            if (types.contains("postal_code")) {
                pincode = name;
            } else if (types.contains("locality")) {
                city = name;
            } else if (types.contains("administrative_area_level_1")) {
                state = name;
            }
        }
        String formatted = JsonNodes.textOrNull(top.path("formatted_address"));
        if (pincode == null) {
            pincode = extractPincode(formatted).orElse(null);
        }
        return Optional.of(new GeocodeResult(location.path("lat").asDouble(), location.path("lng").asDouble(),
                formatted != null ? formatted : input, pincode, city, state));
    }

    private JsonNode get(String uriTemplate, Object... variables) {
        try {
            JsonNode body = mapsRestClient.get()
                    .uri(uriTemplate, variables)
                    .retrieve()
                    .body(JsonNode.class);
            if (body == null) {
                throw new UpstreamProviderException(ErrorCode.MAPS_ERROR, "Empty response from maps provider");
            }
            return body;
        } catch (RestClientException e) {
            throw new UpstreamProviderException(ErrorCode.MAPS_ERROR, "Maps request failed: " + e.getMessage(), e);
        }
    }

    private static String firstText(JsonNode primary, JsonNode secondary, String fallback) {
        String value = JsonNodes.textOrNull(primary);
        if (value == null) {
            value = JsonNodes.textOrNull(secondary);
        }
        return value != null ? value : fallback;
    }
}
