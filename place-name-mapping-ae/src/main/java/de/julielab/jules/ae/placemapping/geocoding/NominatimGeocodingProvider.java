package de.julielab.jules.ae.placemapping.geocoding;

import static de.julielab.jules.ae.placemapping.PlaceMappingConfiguration.*;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import de.julielab.jules.ae.placemapping.PlaceMappingConfiguration;
import de.julielab.jules.ae.placemapping.utils.GeocodingException;
import de.julielab.jules.ae.placemapping.utils.TransientGeocodingException;

/**
 * Geocoding with the search endpoint of an OpenStreetMap Nominatim server.
 * The region hint is appended to the query. The best match's
 * <tt>importance</tt> is used as confidence.
 */
public class NominatimGeocodingProvider implements ExternalGeocodingProvider {
    public static final String PROVIDER_ID = "nominatim";
    public static final String DEFAULT_URL = "https://nominatim.openstreetmap.org";
    public static final double DEFAULT_CONFIDENCE = 0.5;
    private static final Logger log = LoggerFactory.getLogger(NominatimGeocodingProvider.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final String baseUrl;
    private final String userAgent;
    private final Duration timeout;
    private final String countryCodes;

    public NominatimGeocodingProvider(PlaceMappingConfiguration config) {
        this(config.getProperty(NOMINATIM_URL, DEFAULT_URL),
                config.getProperty(NOMINATIM_USER_AGENT, "place-name-mapping/1.0"),
                Duration.ofMillis(config.getInt(NOMINATIM_TIMEOUT_MS, 10000)),
                config.getProperty(NOMINATIM_COUNTRY_CODES, "jp"));
    }

    public NominatimGeocodingProvider(String baseUrl, String userAgent, Duration timeout, String countryCodes) {
        this.baseUrl = StringUtils.removeEnd(baseUrl, "/");
        this.userAgent = userAgent;
        this.timeout = timeout;
        this.countryCodes = countryCodes;
        this.httpClient = HttpClient.newBuilder().connectTimeout(timeout).build();
    }

    @Override
    public String getProviderId() {
        return PROVIDER_ID;
    }

    @Override
    public Optional<ProviderResult> geocode(String placeName, String regionHint) throws GeocodingException {
        String query = StringUtils.isBlank(regionHint) ? placeName : placeName + ", " + regionHint;
        URI uri = URI.create(baseUrl + "/search?q=" + URLEncoder.encode(query, StandardCharsets.UTF_8)
                + "&format=json&limit=1&accept-language=ja"
                + (StringUtils.isBlank(countryCodes) ? "" : "&countrycodes=" + URLEncoder.encode(countryCodes, StandardCharsets.UTF_8)));
        HttpRequest request = HttpRequest.newBuilder(uri).timeout(timeout).header("User-Agent", userAgent)
                .header("Accept", "application/json").GET().build();
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            throw new TransientGeocodingException("Nominatim request for \"" + query + "\" timed out", e);
        } catch (IOException e) {
            throw new TransientGeocodingException("Nominatim request for \"" + query + "\" failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GeocodingException("Interrupted during the Nominatim request for \"" + query + "\"", e);
        }

        int status = response.statusCode();
        if (status == 429 || status >= 500)
            throw new TransientGeocodingException("Nominatim answered with status " + status + " for \"" + query + "\"");
        if (status != 200)
            throw new GeocodingException("Nominatim answered with status " + status + " for \"" + query + "\"");
        return parse(query, response.body());
    }

    private Optional<ProviderResult> parse(String query, String body) throws GeocodingException {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new GeocodingException("Nominatim returned invalid JSON for \"" + query + "\"", e);
        }
        if (root == null || !root.isArray())
            throw new GeocodingException("Nominatim returned an unexpected response for \"" + query + "\": " + body);
        if (root.isEmpty()) {
            log.debug("Nominatim found nothing for \"{}\"", query);
            return Optional.empty();
        }
        JsonNode best = root.get(0);
        double latitude;
        double longitude;
        try {
            latitude = Double.parseDouble(best.path("lat").asText());
            longitude = Double.parseDouble(best.path("lon").asText());
        } catch (NumberFormatException e) {
            throw new GeocodingException("Nominatim returned a result without valid coordinates for \"" + query + "\": " + best, e);
        }
        double confidence = best.hasNonNull("importance") ? best.get("importance").asDouble(DEFAULT_CONFIDENCE) : DEFAULT_CONFIDENCE;
        String displayName = best.hasNonNull("display_name") ? best.get("display_name").asText() : null;
        return Optional.of(new ProviderResult(latitude, longitude, confidence, displayName));
    }
}
