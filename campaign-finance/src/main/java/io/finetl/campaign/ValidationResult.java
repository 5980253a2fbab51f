package io.finetl.campaign;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.Optional;

/**
 * Verdict for one record.
 *
 * @param normalizedAmount the parsed amount column, present whenever it parsed, whatever the verdict
 * @param geographicUnit   state code taken from the record, independent of the verdict
 */
public record ValidationResult(boolean valid, Optional<BigDecimal> normalizedAmount, Optional<String> geographicUnit,
                               Rejection rejection) {
    public ValidationResult {
        Objects.requireNonNull(normalizedAmount, "normalizedAmount");
        Objects.requireNonNull(geographicUnit, "geographicUnit");
        Objects.requireNonNull(rejection, "rejection");
        if (valid != (rejection == Rejection.NONE)) {
            throw new IllegalArgumentException("valid=" + valid + " contradicts rejection=" + rejection);
        }
    }

    static ValidationResult accepted(BigDecimal amount, Optional<String> unit) {
        return new ValidationResult(true, Optional.of(amount), unit, Rejection.NONE);
    }

    static ValidationResult rejected(Rejection why, Optional<BigDecimal> amount, Optional<String> unit) {
        return new ValidationResult(false, amount, unit, why);
    }
}
