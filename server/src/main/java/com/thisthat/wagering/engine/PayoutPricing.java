package com.thisthat.wagering.engine;

import com.thisthat.wagering.entity.Bet;
import com.thisthat.wagering.entity.BetSide;
import com.thisthat.wagering.entity.MarketState;
import com.thisthat.wagering.entity.Money;

import java.math.BigDecimal;

/**
 * Prices bets: the odds a new bet locks in, what a winning bet pays, and what an open position
 * is worth if sold now. Settlement and the betting engine only go through this interface.
 */
public interface PayoutPricing {

    /**
     * Current implied probability of a side, in (0, 1]. Null when the market has no quote.
     */
    BigDecimal oddsFor(MarketState market, BetSide side);

    /**
     * Payout promised at placement for a stake at the given odds.
     */
    Money potentialPayout(Money stake, BigDecimal odds);

    /**
     * Credits paid when the bet's side wins.
     */
    Money payoutFor(Bet bet);

    /**
     * Credits returned when the position is sold before resolution. Never negative.
     */
    Money saleValueFor(Bet bet, MarketState market);
}
