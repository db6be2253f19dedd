package com.gridmaker.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.gridmaker.api.model.Kline;
import com.gridmaker.api.model.Order;
import com.gridmaker.api.model.OrderRequest;
import com.gridmaker.api.model.Side;
import com.gridmaker.config.ExchangeCredentials;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("BackpackRestClient Tests")
class BackpackRestClientTest {

    private static final Clock CLOCK = Clock.fixed(Instant.ofEpochSecond(1_700_000_000L), ZoneOffset.UTC);

    @Mock
    private HttpClient httpClient;

    @Mock
    private HttpResponse<String> response;

    private MeterRegistry registry;
    private BackpackRestClient client;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        var signer = new RequestSigner(new ExchangeCredentials("key", "secret"), "5000", CLOCK);
        var retry = new RetryPolicy("test-rest", 3, Duration.ofMillis(1), Duration.ofMillis(5));
        client = new BackpackRestClient(httpClient, "https://api.example.test/", "v1", 1000,
            signer, retry, registry, CLOCK);
    }

    private void respond(int status, String body) throws Exception {
        doReturn(response).when(httpClient).send(any(), any());
        when(response.statusCode()).thenReturn(status);
        when(response.body()).thenReturn(body);
    }

    private HttpRequest lastRequest() throws Exception {
        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(captor.capture(), any());
        return captor.getValue();
    }

    @Nested
    @DisplayName("Public endpoints")
    class PublicEndpoints {

        @Test
        @DisplayName("Ticker should be an unsigned GET with the symbol in the query")
        void tickerIsUnsignedGet() throws Exception {
            respond(200, "{\"symbol\":\"SOL_USDC\",\"lastPrice\":\"101.5\"}");

            JsonNode ticker = client.getTicker("SOL_USDC");

            HttpRequest request = lastRequest();
            assertThat(ticker.path("lastPrice").asDouble()).isEqualTo(101.5);
            assertThat(request.method()).isEqualTo("GET");
            assertThat(request.uri().toString()).isEqualTo("https://api.example.test/api/v1/ticker?symbol=SOL_USDC");
            assertThat(request.headers().firstValue("X-API-KEY")).isEmpty();
        }

        @Test
        @DisplayName("Klines should ask for history ending now and skip malformed bars")
        void klinesParsed() throws Exception {
            respond(200, """
                [
                  {"start":"2023-11-14 20:00:00","open":"1","high":"2","low":"0.5","close":"1.5","volume":"10"},
                  {"start":"2023-11-14 21:00:00","close":"0"}
                ]
                """);

            List<Kline> klines = client.getKlines("SOL_USDC", "1h", 2);

            assertThat(klines).singleElement().satisfies(kline -> {
                assertThat(kline.close()).isEqualTo(1.5);
                assertThat(kline.start()).isEqualTo("2023-11-14 20:00:00");
            });
            assertThat(lastRequest().uri().getQuery())
                .isEqualTo("symbol=SOL_USDC&interval=1h&limit=2&startTime=1699992800");
        }
    }

    @Nested
    @DisplayName("Signed endpoints")
    class SignedEndpoints {

        @Test
        @DisplayName("Placing an order should POST a signed request and return the acknowledged order")
        void placeOrderSigned() throws Exception {
            respond(200, """
                {"id":"111","symbol":"SOL_USDC","side":"Bid","price":"99.5","quantity":"0.1",
                 "orderType":"Limit","timeInForce":"GTC","postOnly":true}
                """);

            Optional<Order> order = client.placeOrder(OrderRequest.postOnlyLimit("SOL_USDC", Side.BID, 0.1, 99.5));

            HttpRequest request = lastRequest();
            assertThat(order).hasValueSatisfying(o -> {
                assertThat(o.id()).isEqualTo("111");
                assertThat(o.side()).isEqualTo(Side.BID);
                assertThat(o.postOnly()).isTrue();
            });
            assertThat(request.method()).isEqualTo("POST");
            assertThat(request.uri().getPath()).isEqualTo("/api/v1/order");
            assertThat(request.headers().firstValue("X-API-KEY")).contains("key");
            assertThat(request.headers().firstValue("X-TIMESTAMP")).contains("1700000000000");
            assertThat(request.headers().firstValue("X-WINDOW")).contains("5000");
            assertThat(request.headers().firstValue("X-SIGNATURE")).isPresent();
        }

        @Test
        @DisplayName("An order response without an id should be treated as not acknowledged")
        void placeOrderWithoutId() throws Exception {
            respond(200, "{\"status\":\"Rejected\"}");

            assertThat(client.placeOrder(OrderRequest.postOnlyLimit("SOL_USDC", Side.ASK, 0.1, 101.0))).isEmpty();
        }

        @Test
        @DisplayName("Invalid orders should be refused before any request is sent")
        void invalidOrderNeverSent() throws Exception {
            assertThatThrownBy(() -> client.placeOrder(OrderRequest.postOnlyLimit("SOL_USDC", Side.BID, 0.0, 99.0)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("quantity");

            verify(httpClient, never()).send(any(), any());
        }

        @Test
        @DisplayName("Cancel all should be a signed DELETE and accept an empty body")
        void cancelAllEmptyBody() throws Exception {
            respond(200, "");

            client.cancelAllOrders("SOL_USDC");

            HttpRequest request = lastRequest();
            assertThat(request.method()).isEqualTo("DELETE");
            assertThat(request.uri().getPath()).isEqualTo("/api/v1/orders");
            assertThat(request.headers().firstValue("X-SIGNATURE")).isPresent();
        }

        @Test
        @DisplayName("Fill history should use the wapi path")
        void fillHistoryPath() throws Exception {
            respond(200, "[]");

            JsonNode fills = client.getFillHistory("SOL_USDC", 50);

            assertThat(fills.isArray()).isTrue();
            assertThat(lastRequest().uri().getPath()).isEqualTo("/wapi/v1/history/fills");
        }

        @Test
        @DisplayName("Open orders without an id should be skipped")
        void openOrdersParsed() throws Exception {
            respond(200, "[{\"id\":\"111\",\"symbol\":\"SOL_USDC\",\"side\":\"Bid\",\"price\":\"99.5\","
                + "\"quantity\":\"0.1\",\"orderType\":\"Limit\",\"timeInForce\":\"GTC\",\"postOnly\":true},"
                + "{\"symbol\":\"SOL_USDC\",\"side\":\"Ask\"}]");

            List<Order> orders = client.getOpenOrders("SOL_USDC");

            assertThat(orders).singleElement().satisfies(order -> {
                assertThat(order.id()).isEqualTo("111");
                assertThat(order.side()).isEqualTo(Side.BID);
                assertThat(order.price()).isEqualTo(99.5);
                assertThat(order.postOnly()).isTrue();
            });
            assertThat(lastRequest().headers().firstValue("X-API-KEY")).contains("key");
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("A 429 should be retried and the later success returned")
        void rateLimitRetried() throws Exception {
            doReturn(response).when(httpClient).send(any(), any());
            when(response.statusCode()).thenReturn(429, 200);
            when(response.body()).thenReturn("", "{\"USDC\":{\"available\":\"10\",\"locked\":\"0\"}}");

            JsonNode balances = client.getBalances();

            assertThat(balances.path("USDC").path("available").asText()).isEqualTo("10");
            verify(httpClient, times(2)).send(any(), any());
            assertThat(registry.counter("gridmaker.api.success", "operation", "getBalances").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("A persistent server error should surface after the bounded retries")
        void serverErrorSurfaces() throws Exception {
            respond(500, "{\"message\":\"internal\"}");

            assertThatThrownBy(() -> client.getOpenOrders("SOL_USDC"))
                .isInstanceOf(ExchangeException.class)
                .satisfies(e -> assertThat(((ExchangeException) e).getStatusCode()).isEqualTo(500));

            verify(httpClient, times(3)).send(any(), any());
            assertThat(registry.counter("gridmaker.api.failure",
                "operation", "getOpenOrders", "status", "500").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Transport errors should be retried and reported as status 0")
        void transportErrorRetried() throws Exception {
            doThrow(new IOException("connection reset")).when(httpClient).send(any(), any());

            assertThatThrownBy(() -> client.getMarkets())
                .isInstanceOf(ExchangeException.class)
                .satisfies(e -> assertThat(((ExchangeException) e).isTransportError()).isTrue());

            verify(httpClient, times(3)).send(any(), any());
        }
    }

    @ParameterizedTest
    @CsvSource({"1m, 60", "5m, 300", "1h, 3600", "1d, 86400", "1w, 604800", "30s, 30"})
    @DisplayName("Kline intervals should map to durations")
    void intervalDurations(String interval, long seconds) {
        assertThat(BackpackRestClient.intervalDuration(interval)).isEqualTo(Duration.ofSeconds(seconds));
    }

    @Test
    @DisplayName("Unknown interval units should be rejected")
    void invalidInterval() {
        assertThatThrownBy(() -> BackpackRestClient.intervalDuration("3x"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
