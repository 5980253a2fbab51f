package io.finetl.campaign;

/**
 * Checksum test for a national taxpayer id.
 */
@FunctionalInterface
public interface TaxIdValidator {
    boolean isValidTaxId(String id);

    /** Accepts anything non-blank; used when checksum validation is switched off. */
    TaxIdValidator ANY = id -> id != null && !id.isBlank();
}
