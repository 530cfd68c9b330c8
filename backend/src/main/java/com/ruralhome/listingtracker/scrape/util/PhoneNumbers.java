package com.ruralhome.listingtracker.scrape.util;

public final class PhoneNumbers {
    private static final int NATIONAL_DIGITS = 10;

    private PhoneNumbers() {
    }

    /**
     * Keeps digits only and drops a leading country code. Shorter numbers are returned as their digits,
     * and null is returned when no digits remain.
     */
    public static String normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String digits = raw.replaceAll("\\D", "");
        if (digits.isEmpty()) {
            return null;
        }
        if (digits.length() < NATIONAL_DIGITS) {
            return digits;
        }
        return digits.substring(digits.length() - NATIONAL_DIGITS);
    }
}
