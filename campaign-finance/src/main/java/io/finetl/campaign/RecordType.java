package io.finetl.campaign;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * The four campaign-finance record families. Declaration order is classification order: the original-donor marker
 * is tested first because those files are also named after candidate revenues. Revenue files of other bodies
 * ({@code receitas_orgaos_partidarios_*}) carry none of the markers and are skipped.
 */
public enum RecordType {
    ORIGINAL_DONOR("original-donor", "doador_originario", Columns.REVENUE_AMOUNT),
    CONTRACTED_EXPENSE("contracted-expense", "despesas_contratadas", Columns.CONTRACTED_AMOUNT),
    PAID_EXPENSE("paid-expense", "despesas_pagas", Columns.PAYMENT_AMOUNT),
    REVENUE("revenue", "receitas_candidatos", Columns.REVENUE_AMOUNT);

    private final String label;
    private final String fileMarker;
    private final String amountColumn;

    RecordType(String label, String fileMarker, String amountColumn) {
        this.label = label;
        this.fileMarker = fileMarker;
        this.amountColumn = amountColumn;
    }

    public String label() { return label; }
    public String fileMarker() { return fileMarker; }
    public String amountColumn() { return amountColumn; }

    public List<String> requiredColumns() {
        return List.of(Columns.CANDIDATE_TAX_ID, amountColumn);
    }

    /** First type whose marker occurs in the lower-cased file name. */
    public static Optional<RecordType> forFileName(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        for (RecordType t : values()) {
            if (lower.contains(t.fileMarker)) return Optional.of(t);
        }
        return Optional.empty();
    }

    @Override
    public String toString() { return label; }
}
