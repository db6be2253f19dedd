package com.gridmaker.api.model;

import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("OrderRequest Tests")
class OrderRequestTest {

    private final Validator validator = Validation.buildDefaultValidatorFactory().getValidator();

    @Test
    @DisplayName("Post-only ladder order should serialize with plain decimals")
    void shouldSerializePostOnlyLimit() {
        var request = OrderRequest.postOnlyLimit("SOL_USDC_PERP", Side.BID, 0.10, 99.98);

        assertThat(validator.validate(request)).isEmpty();
        assertThat(request.toParams())
            .containsEntry("symbol", "SOL_USDC_PERP")
            .containsEntry("side", "Bid")
            .containsEntry("orderType", "Limit")
            .containsEntry("quantity", "0.1")
            .containsEntry("price", "99.98")
            .containsEntry("timeInForce", "GTC")
            .containsEntry("postOnly", "true")
            .doesNotContainKey("reduceOnly");
        assertThat(List.copyOf(request.toParams().keySet())).isSorted();
    }

    @Test
    @DisplayName("Market close order should carry no price")
    void shouldBuildMarketIoc() {
        var request = OrderRequest.marketIoc("SOL_USDC_PERP", Side.ASK, 1.5);

        assertThat(request.toParams())
            .containsEntry("orderType", "Market")
            .containsEntry("timeInForce", "IOC")
            .doesNotContainKeys("price", "postOnly");
    }

    @Test
    @DisplayName("Auto borrow and lend flags should set their companion flags")
    void shouldExpandBorrowLendFlags() {
        var request = new OrderRequest("SOL_USDC", Side.BID, OrderType.LIMIT, 1.0, 10.0,
            TimeInForce.GTC, false, true, "42", true, false);

        assertThat(request.toParams())
            .containsEntry("autoBorrow", "true")
            .containsEntry("autoBorrowRepay", "true")
            .containsEntry("autoLend", "false")
            .containsEntry("autoLendRedeem", "false")
            .containsEntry("reduceOnly", "true")
            .containsEntry("clientId", "42");
    }

    @Test
    @DisplayName("Limit order without a price should be refused")
    void shouldRequirePriceForLimit() {
        var request = new OrderRequest("SOL_USDC", Side.BID, OrderType.LIMIT, 1.0, null,
            TimeInForce.GTC, true, false, null, null, null);

        assertThatThrownBy(request::validateLimitOrder)
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Limit price");
    }

    @ParameterizedTest(name = "symbol={0} quantity={1}")
    @CsvSource({
        "sol_usdc, 1.0",
        "SOL_USDC, 0.0",
        "SOL_USDC, -1.0",
        "'', 1.0"
    })
    @DisplayName("Bean validation should catch malformed requests")
    void shouldFailValidation(String symbol, double quantity) {
        var request = OrderRequest.postOnlyLimit(symbol, Side.ASK, quantity, 100.0);

        assertThat(validator.validate(request)).isNotEmpty();
    }

    @ParameterizedTest
    @CsvSource({"Bid, BID", "buy, BID", "ASK, ASK", "Sell, ASK"})
    @DisplayName("Side should parse the wire spellings")
    void shouldParseSide(String wire, Side expected) {
        assertThat(Side.fromWire(wire)).isEqualTo(expected);
        assertThat(expected.opposite()).isNotEqualTo(expected);
    }
}
