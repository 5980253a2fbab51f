package io.finetl.campaign;

/** Why a record failed validation. */
public enum Rejection {
    NONE,
    MISSING_FIELD,
    INVALID_AMOUNT,
    NON_POSITIVE_AMOUNT,
    INVALID_TAX_ID
}
