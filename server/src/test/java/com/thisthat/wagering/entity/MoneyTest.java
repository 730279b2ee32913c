package com.thisthat.wagering.entity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MoneyTest {

    @Test
    @DisplayName("values are held at two decimals with banker's rounding")
    void roundsHalfEven() {
        assertThat(Money.of("10.005").toBigDecimal()).isEqualByComparingTo("10.00");
        assertThat(Money.of("10.015").toBigDecimal()).isEqualByComparingTo("10.02");
        assertThat(Money.of(7).toBigDecimal().scale()).isEqualTo(2);
    }

    @Test
    @DisplayName("dividing by odds rounds once, after the full quotient")
    void divideByOdds() {
        assertThat(Money.of(50).divide(new BigDecimal("0.5263"))).isEqualTo(Money.of("95.00"));
        assertThat(Money.of(100).divide(new BigDecimal("0.3"))).isEqualTo(Money.of("333.33"));
    }

    @Test
    @DisplayName("scale keeps precision of the intermediate ratio")
    void scaleByRatio() {
        assertThat(Money.of(100).scale(new BigDecimal("0.6"), new BigDecimal("0.4"))).isEqualTo(Money.of("150.00"));
        assertThat(Money.of(10).scale(new BigDecimal("1"), new BigDecimal("3"))).isEqualTo(Money.of("3.33"));
    }

    @Test
    @DisplayName("equality ignores scale")
    void equalityIgnoresScale() {
        assertThat(Money.of(new BigDecimal("5"))).isEqualTo(Money.of("5.00"));
        assertThat(Money.of("5").hashCode()).isEqualTo(Money.of("5.000").hashCode());
    }

    @Test
    void rejectsBadInput() {
        assertThatThrownBy(() -> Money.of((BigDecimal) null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Money.of("abc")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Money.of(1).divide(BigDecimal.ZERO)).isInstanceOf(ArithmeticException.class);
    }
}
