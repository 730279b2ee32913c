package com.thisthat.wagering.entity;

/**
 * Bet state machine.
 *
 * State Transitions (STRICT - no shortcuts allowed):
 *
 * PENDING → WON       (market resolved to the bet's side)
 * PENDING → LOST      (market resolved to the other side)
 * PENDING → CANCELLED (market invalid and stake refunded, or position sold early)
 *
 * Terminal states: WON, LOST, CANCELLED
 */
public enum BetStatus {

    /**
     * PENDING: stake debited, market not yet resolved.
     */
    PENDING,

    /**
     * WON: payout credited. TERMINAL.
     */
    WON,

    /**
     * LOST: no credit. TERMINAL.
     */
    LOST,

    /**
     * CANCELLED: refunded (market invalid) or sold before resolution. TERMINAL.
     */
    CANCELLED;

    public boolean isTerminal() {
        return this != PENDING;
    }

    /**
     * Validate state transition is legal.
     *
     * @param to the target state
     * @return true if transition is valid
     */
    public boolean canTransitionTo(BetStatus to) {
        return this == PENDING && to != null && to.isTerminal();
    }
}
