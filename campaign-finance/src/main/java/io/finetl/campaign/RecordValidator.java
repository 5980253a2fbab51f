package io.finetl.campaign;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Applies the per-type rule table: every required column present and non-blank, and the type's amount column a
 * number strictly greater than zero. Stateless and safe to share between workers; never throws on bad data.
 */
public class RecordValidator {
    private final TaxIdValidator taxIds;

    public RecordValidator() {
        this(TaxIdValidator.ANY);
    }

    public RecordValidator(TaxIdValidator taxIds) {
        this.taxIds = taxIds;
    }

    public ValidationResult validate(FinanceRecord record) {
        RecordType type = record.recordType();
        Optional<String> unit = geographicUnit(record);
        Optional<BigDecimal> amount = Amounts.parse(record.fields().get(type.amountColumn()));

        for (String column : type.requiredColumns()) {
            String value = record.fields().get(column);
            if (value == null || value.isBlank()) {
                return ValidationResult.rejected(Rejection.MISSING_FIELD, amount, unit);
            }
        }
        if (amount.isEmpty()) {
            return ValidationResult.rejected(Rejection.INVALID_AMOUNT, amount, unit);
        }
        if (amount.get().signum() <= 0) {
            return ValidationResult.rejected(Rejection.NON_POSITIVE_AMOUNT, amount, unit);
        }
        if (!taxIds.isValidTaxId(record.fields().get(Columns.CANDIDATE_TAX_ID).strip())) {
            return ValidationResult.rejected(Rejection.INVALID_TAX_ID, amount, unit);
        }
        return ValidationResult.accepted(amount.get(), unit);
    }

    static Optional<String> geographicUnit(FinanceRecord record) {
        for (String column : new String[] {Columns.STATE, Columns.CANDIDATE_STATE}) {
            String v = record.fields().get(column);
            if (v != null && !v.isBlank()) return Optional.of(v.strip());
        }
        return Optional.empty();
    }
}
