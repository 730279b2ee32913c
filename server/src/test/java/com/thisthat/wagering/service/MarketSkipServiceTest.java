package com.thisthat.wagering.service;

import com.thisthat.wagering.config.WageringProperties;
import com.thisthat.wagering.entity.InteractionAction;
import com.thisthat.wagering.entity.MarketInteraction;
import com.thisthat.wagering.exception.ValidationException;
import com.thisthat.wagering.repositories.MarketInteractionRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MarketSkipServiceTest {

    private static final Instant T = Instant.parse("2026-03-01T00:00:00Z");

    @Mock
    MarketInteractionRepository marketInteractionRepository;

    private MarketSkipService at(Instant now) {
        return new MarketSkipService(marketInteractionRepository, new WageringProperties(), Clock.fixed(now, ZoneOffset.UTC));
    }

    private static MarketInteraction skip(String marketId, Instant expiresAt) {
        return MarketInteraction.builder()
                .userId("u1")
                .marketId(marketId)
                .action(InteractionAction.SKIP)
                .timestamp(T)
                .expiresAt(expiresAt)
                .build();
    }

    @Test
    @DisplayName("a skip expires three days after it was made")
    void skipSetsThreeDayTtl() {
        Instant expiresAt = T.plus(Duration.ofDays(3));
        when(marketInteractionRepository.upsert("u1", "m1", InteractionAction.SKIP, T, expiresAt))
                .thenReturn(skip("m1", expiresAt));

        SkipResult result = at(T).skip("u1", "m1");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getExpiresAt()).isEqualTo(expiresAt);
    }

    @Test
    @DisplayName("listSkipped asks only for skips still alive at the current time")
    void listSkippedUsesNow() {
        Instant oneDayLater = T.plus(Duration.ofDays(1));
        when(marketInteractionRepository.findByUserIdAndActionAndExpiresAtAfter("u1", InteractionAction.SKIP, oneDayLater))
                .thenReturn(List.of(skip("m1", T.plus(Duration.ofDays(3))), skip("m2", T.plus(Duration.ofDays(2)))));

        assertThat(at(oneDayLater).listSkipped("u1")).containsExactly("m1", "m2");
    }

    @Test
    @DisplayName("cleanup deletes skips expiring at or before now")
    void cleanupExpired() {
        Instant fourDaysLater = T.plus(Duration.ofDays(4));
        when(marketInteractionRepository.deleteByActionAndExpiresAtLessThanEqual(InteractionAction.SKIP, fourDaysLater))
                .thenReturn(2L);

        assertThat(at(fourDaysLater).cleanupExpired()).isEqualTo(2);
    }

    @Test
    void removeSkip() {
        when(marketInteractionRepository.deleteByUserIdAndMarketIdAndAction("u1", "m1", InteractionAction.SKIP))
                .thenReturn(1L);

        assertThat(at(T).removeSkip("u1", "m1")).isTrue();
        verify(marketInteractionRepository).deleteByUserIdAndMarketIdAndAction("u1", "m1", InteractionAction.SKIP);
    }

    @Test
    void skipRequiresIds() {
        assertThatThrownBy(() -> at(T).skip("u1", " ")).isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("listing skips requires a user id")
    void listSkippedRequiresUser() {
        assertThatThrownBy(() -> at(T).listSkipped(null))
                .isInstanceOf(ValidationException.class)
                .hasMessage("userId is required");
        assertThatThrownBy(() -> at(T).listSkipped(""))
                .isInstanceOf(ValidationException.class);
    }
}
