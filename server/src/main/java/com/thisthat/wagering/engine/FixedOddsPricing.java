package com.thisthat.wagering.engine;

import com.thisthat.wagering.entity.Bet;
import com.thisthat.wagering.entity.BetSide;
import com.thisthat.wagering.entity.MarketState;
import com.thisthat.wagering.entity.Money;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Fixed-odds pricing. Odds are the implied probability of the chosen side at placement.
 *
 * potentialPayout = stake / oddsAtBet, paid in full on a win.
 * saleValue      = stake * currentOdds / oddsAtBet, floored at zero.
 *
 * Example: 50 credits on THIS at 0.5263 pays 95.00.
 */
@Component
public class FixedOddsPricing implements PayoutPricing {

    @Override
    public BigDecimal oddsFor(MarketState market, BetSide side) {
        return market.oddsFor(side);
    }

    @Override
    public Money potentialPayout(Money stake, BigDecimal odds) {
        return stake.divide(odds);
    }

    @Override
    public Money payoutFor(Bet bet) {
        if (bet.getPotentialPayout() != null) {
            return Money.of(bet.getPotentialPayout());
        }
        return potentialPayout(Money.of(bet.getAmount()), bet.getOddsAtBet());
    }

    @Override
    public Money saleValueFor(Bet bet, MarketState market) {
        BigDecimal currentOdds = oddsFor(market, bet.getSide());
        if (currentOdds == null || currentOdds.signum() <= 0) {
            return Money.ZERO;
        }
        return Money.of(bet.getAmount()).scale(currentOdds, bet.getOddsAtBet()).max(Money.ZERO);
    }
}
