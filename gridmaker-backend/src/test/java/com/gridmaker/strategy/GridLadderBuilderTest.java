package com.gridmaker.strategy;

import com.gridmaker.indicators.BandSnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("GridLadderBuilder Tests")
class GridLadderBuilderTest {

    private static final BandSnapshot BAND = new BandSnapshot(105.0, 100.0, 95.0, true);

    private static GridLadderBuilder builder(boolean tradeInBand, boolean buyBelowSma) {
        return new GridLadderBuilder(6, 0.0002, 2, 2, 70.0, 0.5, 0.1, 0.0005, tradeInBand, buyBelowSma);
    }

    @Test
    @DisplayName("Should step levels out from the price on both sides")
    void buildsSymmetricLevels() {
        var ladder = builder(false, false).build(100.0, 0.0, BAND);

        assertThat(ladder.buyPrices()).containsExactly(99.98, 99.96, 99.94, 99.92, 99.9, 99.88);
        assertThat(ladder.sellPrices()).containsExactly(100.02, 100.04, 100.06, 100.08, 100.1, 100.12);
        assertThat(ladder.quantity()).isEqualTo(0.1);
        assertThat(ladder.buyCap()).isEqualTo(35.0);
        assertThat(ladder.sellCap()).isCloseTo(0.35, within(1e-12));
        assertThat(ladder.canBuy()).isTrue();
        assertThat(ladder.canSell()).isTrue();
    }

    @Test
    @DisplayName("Should drop sell levels that do not clear cost plus the minimum profit")
    void filtersUnprofitableSells() {
        var ladder = builder(false, false).build(100.0, 100.05, BAND);

        assertThat(ladder.sellPrices()).containsExactly(100.12);
        assertThat(ladder.buyPrices()).hasSize(6);
    }

    @Test
    @DisplayName("Outside the band nothing should be tradable when trading in band")
    void bandGating() {
        var ladder = builder(true, false).build(110.0, 0.0, BAND);

        assertThat(ladder.canBuy()).isFalse();
        assertThat(ladder.canSell()).isFalse();
        assertThat(builder(true, false).build(100.0, 0.0, BAND).canBuy()).isTrue();
    }

    @Test
    @DisplayName("Buying above the middle band should be blocked when buying below SMA")
    void buyBelowSmaGating() {
        var above = builder(false, true).build(101.0, 0.0, BAND);
        var below = builder(false, true).build(99.0, 0.0, BAND);

        assertThat(above.canBuy()).isFalse();
        assertThat(above.canSell()).isTrue();
        assertThat(below.canBuy()).isTrue();
    }

    @Test
    @DisplayName("Should round half up to the configured precision")
    void rounding() {
        var builder = builder(false, false);

        assertThat(builder.roundPrice(1.005)).isEqualTo(1.01);
        assertThat(builder.roundPrice(99.984)).isEqualTo(99.98);
        assertThat(builder.roundQuantity(0.123456)).isEqualTo(0.12);
    }
}
