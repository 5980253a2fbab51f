package io.finetl.campaign;

/**
 * CPF (11 digits) and CNPJ (14 digits) check-digit validation. Formatting characters are ignored.
 */
public final class BrazilianTaxIds implements TaxIdValidator {
    private static final int[] CNPJ_WEIGHTS_1 = {5, 4, 3, 2, 9, 8, 7, 6, 5, 4, 3, 2};
    private static final int[] CNPJ_WEIGHTS_2 = {6, 5, 4, 3, 2, 9, 8, 7, 6, 5, 4, 3, 2};

    @Override
    public boolean isValidTaxId(String id) {
        String digits = digitsOf(id);
        return switch (digits.length()) {
            case 11 -> isValidCpf(digits);
            case 14 -> isValidCnpj(digits);
            default -> false;
        };
    }

    public static boolean isValidCpf(String cpf) {
        String d = digitsOf(cpf);
        if (d.length() != 11 || allSame(d)) return false;
        int sum1 = 0;
        for (int i = 0; i < 9; i++) sum1 += digit(d, i) * (10 - i);
        int sum2 = 0;
        for (int i = 0; i < 10; i++) sum2 += digit(d, i) * (11 - i);
        return digit(d, 9) == checkDigit(sum1) && digit(d, 10) == checkDigit(sum2);
    }

    public static boolean isValidCnpj(String cnpj) {
        String d = digitsOf(cnpj);
        if (d.length() != 14 || allSame(d)) return false;
        int sum1 = 0;
        for (int i = 0; i < 12; i++) sum1 += digit(d, i) * CNPJ_WEIGHTS_1[i];
        int sum2 = 0;
        for (int i = 0; i < 13; i++) sum2 += digit(d, i) * CNPJ_WEIGHTS_2[i];
        return digit(d, 12) == checkDigit(sum1) && digit(d, 13) == checkDigit(sum2);
    }

    static String digitsOf(String s) {
        if (s == null) return "";
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c >= '0' && c <= '9') sb.append(c);
        }
        return sb.toString();
    }

    private static int checkDigit(int sum) {
        int r = sum % 11;
        return r < 2 ? 0 : 11 - r;
    }

    private static int digit(String s, int i) { return s.charAt(i) - '0'; }

    private static boolean allSame(String s) {
        for (int i = 1; i < s.length(); i++) {
            if (s.charAt(i) != s.charAt(0)) return false;
        }
        return true;
    }
}
