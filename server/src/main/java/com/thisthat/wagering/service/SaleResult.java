package com.thisthat.wagering.service;

import com.thisthat.wagering.entity.Bet;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class SaleResult {
    Bet bet;
    BigDecimal creditsReturned;
    BigDecimal newBalance;
}
