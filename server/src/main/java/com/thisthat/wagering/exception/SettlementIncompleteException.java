package com.thisthat.wagering.exception;

import com.thisthat.wagering.service.SettlementResult;

import lombok.Getter;

import java.util.List;

/**
 * Some bets of a market could not be settled. Bets listed in {@link #getResult()} are final;
 * re-running settlement only touches the ones still pending.
 */
@Getter
public class SettlementIncompleteException extends WageringException {

    public static final String CODE = "SETTLEMENT_INCOMPLETE";

    private final SettlementResult result;
    private final List<String> failedBetIds;

    public SettlementIncompleteException(String marketId, SettlementResult result, List<String> failedBetIds,
                                         Throwable firstFailure) {
        super(CODE, "Settlement of market " + marketId + " incomplete: " + failedBetIds.size() + " bet(s) failed",
                firstFailure);
        this.result = result;
        this.failedBetIds = List.copyOf(failedBetIds);
    }
}
