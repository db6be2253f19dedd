package com.gridmaker.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gridmaker.api.model.Kline;
import com.gridmaker.api.model.Order;
import com.gridmaker.api.model.OrderRequest;
import com.gridmaker.config.MakerConfig;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Backpack REST client.
 *
 * Every call goes rate limiter -> retry -> HTTP, and is timed on the meter registry.
 * Private endpoints are signed with {@link RequestSigner}.
 */
public class BackpackRestClient implements ExchangeGateway {
    private static final Logger logger = LoggerFactory.getLogger(BackpackRestClient.class);

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(10);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Validator validator = Validation.buildDefaultValidatorFactory().getValidator();
    private final RequestSigner signer;
    private final RetryPolicy retryPolicy;
    private final RateLimiter rateLimiter;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final String baseUrl;
    private final String apiVersion;

    public BackpackRestClient(MakerConfig config, RequestSigner signer, RetryPolicy retryPolicy,
                              MeterRegistry meterRegistry) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(),
            config.getApiUrl(), config.getApiVersion(), config.getRestRequestsPerSecond(),
            signer, retryPolicy, meterRegistry, Clock.systemUTC());
    }

    public BackpackRestClient(HttpClient httpClient, String baseUrl, String apiVersion, int requestsPerSecond,
                              RequestSigner signer, RetryPolicy retryPolicy, MeterRegistry meterRegistry,
                              Clock clock) {
        this.httpClient = httpClient;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiVersion = apiVersion;
        this.signer = signer;
        this.retryPolicy = retryPolicy;
        this.meterRegistry = meterRegistry;
        this.clock = clock;

        var rlConfig = RateLimiterConfig.custom()
            .limitForPeriod(requestsPerSecond)
            .limitRefreshPeriod(Duration.ofSeconds(1))
            .timeoutDuration(Duration.ofSeconds(5))
            .build();
        this.rateLimiter = RateLimiter.of("backpack-rest", rlConfig);

        logger.info("Backpack REST client initialized: {} (api {}, {} req/s)", this.baseUrl, apiVersion, requestsPerSecond);
    }

    // ==================== Public market data ====================

    @Override
    public JsonNode getTicker(String symbol) {
        return call("getTicker", "GET", api("/ticker"), null, Map.of("symbol", symbol));
    }

    @Override
    public JsonNode getDepth(String symbol) {
        return call("getDepth", "GET", api("/depth"), null, Map.of("symbol", symbol));
    }

    @Override
    public JsonNode getMarkets() {
        return call("getMarkets", "GET", api("/markets"), null, Map.of());
    }

    @Override
    public List<Kline> getKlines(String symbol, String interval, int limit) {
        long startTime = clock.instant().minus(intervalDuration(interval).multipliedBy(limit)).getEpochSecond();
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", symbol);
        params.put("interval", interval);
        params.put("limit", String.valueOf(limit));
        params.put("startTime", String.valueOf(startTime));

        JsonNode node = call("getKlines", "GET", api("/klines"), null, params);
        List<Kline> klines = new ArrayList<>();
        if (node.isArray()) {
            for (JsonNode element : node) {
                try {
                    klines.add(objectMapper.treeToValue(element, Kline.class));
                } catch (JsonProcessingException e) {
                    logger.debug("Skipping malformed kline {}: {}", element, e.getOriginalMessage());
                }
            }
        }
        return klines;
    }

    // ==================== Private endpoints ====================

    @Override
    public Optional<Order> placeOrder(OrderRequest request) {
        request.validateLimitOrder();
        var violations = validator.validate(request);
        if (!violations.isEmpty()) {
            var errors = violations.stream()
                .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                .sorted()
                .toList();
            throw new IllegalArgumentException("Invalid order: " + String.join(", ", errors));
        }

        JsonNode response = call("placeOrder", "POST", api("/order"), "orderExecute", request.toParams());
        return Optional.ofNullable(Order.fromJson(response));
    }

    @Override
    public void cancelOrder(String symbol, String orderId) {
        call("cancelOrder", "DELETE", api("/order"), "orderCancel", Map.of("orderId", orderId, "symbol", symbol));
    }

    @Override
    public void cancelAllOrders(String symbol) {
        call("cancelAllOrders", "DELETE", api("/orders"), "orderCancelAll", Map.of("symbol", symbol));
    }

    @Override
    public List<Order> getOpenOrders(String symbol) {
        JsonNode node = call("getOpenOrders", "GET", api("/orders"), "orderQueryAll", Map.of("symbol", symbol));
        List<Order> orders = new ArrayList<>();
        if (node.isArray()) {
            for (JsonNode element : node) {
                Order order = Order.fromJson(element);
                if (order != null) {
                    orders.add(order);
                }
            }
        }
        return orders;
    }

    @Override
    public JsonNode getBalances() {
        return call("getBalances", "GET", api("/capital"), "balanceQuery", Map.of());
    }

    @Override
    public JsonNode getFillHistory(String symbol, int limit) {
        return call("getFillHistory", "GET", "/wapi/" + apiVersion + "/history/fills", "fillHistoryQueryAll",
            Map.of("symbol", symbol, "limit", String.valueOf(limit)));
    }

    @Override
    public JsonNode getBorrowLendPositions() {
        return call("getBorrowLendPositions", "GET", api("/borrowLend/positions"), "borrowLendPositionQuery", Map.of());
    }

    // ==================== Plumbing ====================

    private String api(String path) {
        return "/api/" + apiVersion + path;
    }

    /**
     * Execute with full resilience: rate limit -> retry -> metrics.
     * GET sends params as the query string, POST and DELETE as a JSON body.
     */
    private JsonNode call(String operation, String method, String path, String instruction, Map<String, String> params) {
        var timer = Timer.builder("gridmaker.api.call")
            .tag("operation", operation)
            .register(meterRegistry);

        Supplier<JsonNode> attempt = () -> {
            try {
                return RateLimiter.decorateSupplier(rateLimiter, () -> send(method, path, instruction, params)).get();
            } catch (RequestNotPermitted e) {
                throw new ExchangeException("Client-side rate limit exceeded for " + operation, 429);
            }
        };

        try {
            JsonNode result = timer.record(() -> retryPolicy.execute(operation, attempt));
            meterRegistry.counter("gridmaker.api.success", "operation", operation).increment();
            return result;
        } catch (ExchangeException e) {
            meterRegistry.counter("gridmaker.api.failure",
                "operation", operation,
                "status", String.valueOf(e.getStatusCode())).increment();
            throw e;
        }
    }

    private JsonNode send(String method, String path, String instruction, Map<String, String> params) {
        boolean queryParams = "GET".equals(method);
        String url = baseUrl + path;
        if (queryParams && !params.isEmpty()) {
            url += "?" + params.entrySet().stream()
                .map(e -> e.getKey() + "=" + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
        }

        var builder = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .timeout(REQUEST_TIMEOUT)
            .header("Content-Type", "application/json");

        if (instruction != null) {
            signer.headers(instruction, params).forEach(builder::header);
        }

        if (queryParams || params.isEmpty()) {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        } else {
            try {
                builder.method(method, HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(params)));
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Cannot serialize request body", e);
            }
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ExchangeException(method + " " + path + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExchangeException(method + " " + path + " interrupted", ExchangeException.INTERRUPTED);
        }

        int status = response.statusCode();
        String body = response.body();
        if (status == 200 || status == 201) {
            if (body == null || body.isBlank()) {
                return objectMapper.createObjectNode();
            }
            try {
                return objectMapper.readTree(body);
            } catch (JsonProcessingException e) {
                // Some endpoints answer with a bare string, e.g. an order status
                return objectMapper.getNodeFactory().textNode(body);
            }
        }

        if (status == 429) {
            logger.warn("🛑 Rate limited on {} {}", method, path);
        } else {
            logger.warn("{} {} returned {}: {}", method, path, status, truncate(body));
        }
        throw new ExchangeException(method + " " + path + " returned " + status + ": " + truncate(body), status);
    }

    /**
     * Parse Backpack kline intervals such as 1m, 5m, 1h, 1d, 1w.
     */
    static Duration intervalDuration(String interval) {
        if (interval == null || interval.length() < 2) {
            throw new IllegalArgumentException("Invalid interval: " + interval);
        }
        long amount = Long.parseLong(interval.substring(0, interval.length() - 1));
        return switch (interval.charAt(interval.length() - 1)) {
            case 's' -> Duration.ofSeconds(amount);
            case 'm' -> Duration.ofMinutes(amount);
            case 'h' -> Duration.ofHours(amount);
            case 'd' -> Duration.ofDays(amount);
            case 'w' -> Duration.ofDays(7 * amount);
            case 'M' -> Duration.ofDays(30 * amount);
            default -> throw new IllegalArgumentException("Invalid interval: " + interval);
        };
    }

    private static String truncate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > 200 ? body.substring(0, 200) + "..." : body;
    }
}
