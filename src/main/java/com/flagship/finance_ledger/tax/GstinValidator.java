package com.flagship.finance_ledger.tax;

import lombok.Builder;
import lombok.Value;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * GSTIN structure and checksum validation.
 *
 * Layout: 2-digit state code, 10-character PAN, entity code, the literal {@code Z}, and a
 * check character. The check character is a mod-36 weighted sum over {@code 0-9A-Z} with
 * factors alternating 1, 2 from the left.
 */
public final class GstinValidator {

    public static final int LENGTH = 15;

    private static final String ALPHABET = "0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZ";
    private static final int MODULUS = ALPHABET.length();
    private static final Pattern FORMAT =
            Pattern.compile("^[0-9]{2}[A-Z]{5}[0-9]{4}[A-Z][1-9A-Z]Z[0-9A-Z]$");

    @Value
    @Builder
    public static class Result {
        boolean valid;
        String gstin;
        String stateCode;
        String stateName;
        String pan;
        String entityCode;
        String checksum;
        String error;

        static Result invalid(String gstin, String error) {
            return Result.builder().valid(false).gstin(gstin).error(error).build();
        }
    }

    private GstinValidator() {
        // Utility class
    }

    public static Result validate(String input) {
        if (input == null || input.isBlank()) {
            return Result.invalid(input, "GSTIN is empty");
        }
        String gstin = input.strip().toUpperCase(Locale.ROOT);

        if (gstin.length() != LENGTH) {
            return Result.invalid(gstin, "GSTIN must be 15 characters");
        }
        if (!FORMAT.matcher(gstin).matches()) {
            return Result.invalid(gstin, "Invalid GSTIN format");
        }

        String stateCode = gstin.substring(0, 2);
        Optional<IndianState> state = IndianState.fromCode(stateCode);
        if (state.isEmpty()) {
            return Result.invalid(gstin, "Invalid state code: " + stateCode);
        }

        char expected = checkCharacter(gstin.substring(0, LENGTH - 1));
        if (gstin.charAt(LENGTH - 1) != expected) {
            return Result.invalid(gstin, "Invalid GSTIN checksum. Expected " + expected + " at position 15.");
        }

        return Result.builder()
                .valid(true)
                .gstin(gstin)
                .stateCode(stateCode)
                .stateName(state.get().getDisplayName())
                .pan(gstin.substring(2, 12))
                .entityCode(gstin.substring(12, 13))
                .checksum(gstin.substring(14))
                .build();
    }

    /**
     * Computes the check character for the first 14 characters of a GSTIN.
     *
     * @throws IllegalArgumentException if the input is not 14 characters of {@code 0-9A-Z}
     */
    public static char checkCharacter(String first14) {
        if (first14 == null || first14.length() != LENGTH - 1) {
            throw new IllegalArgumentException("Checksum needs exactly 14 characters");
        }
        int factor = 1;
        int total = 0;
        for (char c : first14.toUpperCase(Locale.ROOT).toCharArray()) {
            int digit = ALPHABET.indexOf(c);
            if (digit < 0) {
                throw new IllegalArgumentException("Invalid GSTIN character: " + c);
            }
            int product = factor * digit;
            total += (product / MODULUS) + (product % MODULUS);
            factor = factor == 1 ? 2 : 1;
        }
        return ALPHABET.charAt((MODULUS - (total % MODULUS)) % MODULUS);
    }
}
