package com.thisthat.wagering.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Wagering core settings, bound from {@code wagering.*}.
 */
@ConfigurationProperties(prefix = "wagering")
@NoArgsConstructor
@Getter
@Setter
public class WageringProperties {

    private Bet bet = new Bet();
    private Account account = new Account();
    private Daily daily = new Daily();
    private Skip skip = new Skip();
    private Market market = new Market();
    private Store store = new Store();
    private Leaderboard leaderboard = new Leaderboard();
    private Jobs jobs = new Jobs();

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Bet {
        /** Smallest accepted stake, inclusive. */
        private BigDecimal min = new BigDecimal("10");
        /** Largest accepted stake, inclusive. */
        private BigDecimal max = new BigDecimal("10000");
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Account {
        /** Credits granted when an account is opened. Zero disables the grant. */
        private BigDecimal startingCredits = new BigDecimal("1000");
    }

    /**
     * Daily claim schedule. The first claim ever pays {@code firstClaim}; later claims pay
     * {@code base} for streak days 1 to 3, then {@code streakBonus} more every
     * {@code streakBonusInterval} days.
     */
    @NoArgsConstructor
    @Getter
    @Setter
    public static class Daily {
        private BigDecimal firstClaim = new BigDecimal("500");
        private BigDecimal base = new BigDecimal("100");
        private BigDecimal streakBonus = new BigDecimal("50");
        private int streakBonusInterval = 2;
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Skip {
        /** How long a skipped market stays hidden from the user. */
        private Duration ttl = Duration.ofDays(3);
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Market {
        /** Upper bound on a market status lookup before the request fails closed. */
        private Duration lookupTimeout = Duration.ofSeconds(2);
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Store {
        /** Attempts (including the first) for a unit of work hitting a transient store error. */
        private int maxAttempts = 3;
        /** Backoff before the second attempt; doubles on each further attempt. */
        private Duration initialBackoff = Duration.ofMillis(50);
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Leaderboard {
        private String pnlKey = "leaderboard:live:pnl";
        private String volumeKey = "leaderboard:live:volume";
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Jobs {
        private Job leaderboardSync = new Job(Duration.ofMinutes(5));
        private Job skipCleanup = new Job(Duration.ofHours(1));
        private Job marketSettlement = new Job(Duration.ofMinutes(1));
        private Job ledgerAudit = new Job(Duration.ofMinutes(30));
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Job {
        /** Start with the application context. */
        private boolean autoStartup = true;
        /** Fixed rate between cycle starts; the first cycle runs immediately. */
        private Duration interval = Duration.ofMinutes(5);

        public Job(Duration interval) {
            this.interval = interval;
        }
    }
}
