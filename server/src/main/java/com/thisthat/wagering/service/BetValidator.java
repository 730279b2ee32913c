package com.thisthat.wagering.service;

import com.thisthat.wagering.config.WageringProperties;
import com.thisthat.wagering.entity.BetRequest;
import com.thisthat.wagering.entity.Money;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Request-shape validation for bet placement. Read-only, runs before any lookup or mutation.
 * Market state and funds are checked later, by the betting engine and the ledger.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BetValidator {

    static final int MAX_IDEMPOTENCY_KEY_LENGTH = 128;

    private final WageringProperties properties;

    /**
     * Result of request validation.
     */
    public static class ValidationResult {
        private final List<String> errors;

        private ValidationResult(List<String> errors) {
            this.errors = errors;
        }

        public static ValidationResult valid() {
            return new ValidationResult(List.of());
        }

        public static ValidationResult invalid(List<String> errors) {
            return new ValidationResult(List.copyOf(errors));
        }

        public boolean isValid() {
            return errors.isEmpty();
        }

        public List<String> getErrors() {
            return errors;
        }

        public String getErrorMessage() {
            return String.join("; ", errors);
        }
    }

    public ValidationResult validate(BetRequest request) {
        if (request == null) {
            return ValidationResult.invalid(List.of("request is required"));
        }
        List<String> errors = new ArrayList<>();

        validateFields(request, errors);
        validateAmount(request.getAmount(), errors);

        if (errors.isEmpty()) {
            return ValidationResult.valid();
        }
        log.warn("Bet validation failed: {} (userId={}, marketId={})",
                errors, request.getUserId(), request.getMarketId());
        return ValidationResult.invalid(errors);
    }

    private void validateFields(BetRequest request, List<String> errors) {
        if (request.getUserId() == null || request.getUserId().trim().isEmpty()) {
            errors.add("userId is required");
        }
        if (request.getMarketId() == null || request.getMarketId().trim().isEmpty()) {
            errors.add("marketId is required");
        }
        if (request.getSide() == null) {
            errors.add("side must be THIS or THAT");
        }
        String key = request.getIdempotencyKey();
        if (key != null && (key.isBlank() || key.length() > MAX_IDEMPOTENCY_KEY_LENGTH)) {
            errors.add(String.format("idempotencyKey must be 1 to %d characters", MAX_IDEMPOTENCY_KEY_LENGTH));
        }
    }

    private void validateAmount(BigDecimal amount, List<String> errors) {
        if (amount == null) {
            errors.add("amount is required");
            return;
        }
        if (amount.stripTrailingZeros().scale() > Money.SCALE) {
            errors.add("amount cannot have more than 2 decimal places");
        }
        WageringProperties.Bet limits = properties.getBet();
        if (amount.compareTo(limits.getMin()) < 0) {
            errors.add(String.format("amount must be at least %s", limits.getMin().toPlainString()));
        }
        if (amount.compareTo(limits.getMax()) > 0) {
            errors.add(String.format("amount cannot exceed %s", limits.getMax().toPlainString()));
        }
    }
}
