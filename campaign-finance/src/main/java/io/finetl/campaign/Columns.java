package io.finetl.campaign;

/**
 * Column names exactly as the electoral authority publishes them in the finance CSV headers.
 * Validation looks fields up by these literal names only.
 */
public final class Columns {
    private Columns() {}

    public static final String CANDIDATE_TAX_ID = "NR_CPF_CANDIDATO";
    public static final String REVENUE_AMOUNT = "VR_RECEITA";
    public static final String CONTRACTED_AMOUNT = "VR_DESPESA_CONTRATADA";
    public static final String PAYMENT_AMOUNT = "VR_PAGAMENTO";
    public static final String STATE = "SG_UF";
    public static final String CANDIDATE_STATE = "SG_UF_CANDIDATO";
}
