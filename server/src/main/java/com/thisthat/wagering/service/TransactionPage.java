package com.thisthat.wagering.service;

import com.thisthat.wagering.entity.CreditTransaction;
import lombok.Value;

import java.util.List;

@Value
public class TransactionPage {
    List<CreditTransaction> transactions;
    /** Matching entries across all pages. */
    long total;
    int limit;
    long offset;
}
