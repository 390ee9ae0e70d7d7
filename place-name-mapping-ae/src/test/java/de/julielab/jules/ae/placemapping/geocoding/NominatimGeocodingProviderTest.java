package de.julielab.jules.ae.placemapping.geocoding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.sun.net.httpserver.HttpServer;

import de.julielab.jules.ae.placemapping.utils.GeocodingException;
import de.julielab.jules.ae.placemapping.utils.TransientGeocodingException;

class NominatimGeocodingProviderTest {

    private HttpServer server;
    private final AtomicReference<Integer> status = new AtomicReference<>(200);
    private final AtomicReference<String> body = new AtomicReference<>("[]");
    private final AtomicReference<String> lastQuery = new AtomicReference<>();
    private final AtomicReference<String> lastUserAgent = new AtomicReference<>();
    private NominatimGeocodingProvider provider;

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/search", exchange -> {
            lastQuery.set(URLDecoder.decode(exchange.getRequestURI().getRawQuery(), StandardCharsets.UTF_8));
            lastUserAgent.set(exchange.getRequestHeaders().getFirst("User-Agent"));
            byte[] bytes = body.get().getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json; charset=utf-8");
            exchange.sendResponseHeaders(status.get(), bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        });
        server.start();
        provider = new NominatimGeocodingProvider("http://127.0.0.1:" + server.getAddress().getPort() + "/",
                "place-name-mapping-test", Duration.ofSeconds(5), "jp");
    }

    @AfterEach
    void stopServer() {
        if (server != null)
            server.stop(0);
    }

    @Test
    void parsesBestMatch() throws Exception {
        body.set("[{\"lat\":\"35.6947\",\"lon\":\"139.9827\",\"importance\":0.62,\"display_name\":\"船橋市, 千葉県, 日本\"},"
                + "{\"lat\":\"0\",\"lon\":\"0\"}]");

        Optional<ProviderResult> result = provider.geocode("船橋市", "千葉県");

        assertThat(result).isPresent();
        assertThat(result.get().getLatitude()).isEqualTo(35.6947);
        assertThat(result.get().getLongitude()).isEqualTo(139.9827);
        assertThat(result.get().getConfidence()).isEqualTo(0.62);
        assertThat(result.get().getDisplayName()).isEqualTo("船橋市, 千葉県, 日本");
        assertThat(lastQuery.get()).contains("q=船橋市, 千葉県").contains("format=json").contains("countrycodes=jp");
        assertThat(lastUserAgent.get()).isEqualTo("place-name-mapping-test");
    }

    @Test
    void missingImportanceUsesDefaultConfidence() throws Exception {
        body.set("[{\"lat\":\"35.0\",\"lon\":\"139.0\"}]");

        assertThat(provider.geocode("船橋市", null).get().getConfidence())
                .isEqualTo(NominatimGeocodingProvider.DEFAULT_CONFIDENCE);
        assertThat(lastQuery.get()).contains("q=船橋市&");
    }

    @Test
    void emptyResultIsNotFound() throws Exception {
        body.set("[]");

        assertThat(provider.geocode("架空町", null)).isEmpty();
    }

    @Test
    void rateLimitIsTransient() {
        status.set(429);
        body.set("{}");

        assertThatThrownBy(() -> provider.geocode("船橋市", null)).isInstanceOf(TransientGeocodingException.class);
    }

    @Test
    void serverErrorIsTransient() {
        status.set(503);
        body.set("unavailable");

        assertThatThrownBy(() -> provider.geocode("船橋市", null)).isInstanceOf(TransientGeocodingException.class);
    }

    @Test
    void clientErrorIsPermanent() {
        status.set(404);
        body.set("not here");

        assertThatThrownBy(() -> provider.geocode("船橋市", null)).isInstanceOf(GeocodingException.class)
                .isNotInstanceOf(TransientGeocodingException.class);
    }

    @Test
    void invalidJsonIsPermanent() {
        body.set("<html>");

        assertThatThrownBy(() -> provider.geocode("船橋市", null)).isInstanceOf(GeocodingException.class)
                .isNotInstanceOf(TransientGeocodingException.class);
    }

    @Test
    void unreachableServerIsTransient() {
        server.stop(0);
        server = null;

        assertThatThrownBy(() -> provider.geocode("船橋市", null)).isInstanceOf(TransientGeocodingException.class);
    }
}
