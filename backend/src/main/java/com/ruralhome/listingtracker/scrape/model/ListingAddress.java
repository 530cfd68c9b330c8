package com.ruralhome.listingtracker.scrape.model;

public record ListingAddress(
    String line,
    String city,
    String county,
    String stateCode,
    String postalCode
) {
    public static ListingAddress empty() {
        return new ListingAddress(null, null, null, null, null);
    }

    public String formatted() {
        StringBuilder sb = new StringBuilder();
        appendPart(sb, line);
        appendPart(sb, city);
        if (stateCode != null && !stateCode.isBlank()) {
            appendPart(sb, postalCode == null || postalCode.isBlank() ? stateCode : stateCode + " " + postalCode);
        } else {
            appendPart(sb, postalCode);
        }
        return sb.toString();
    }

    private static void appendPart(StringBuilder sb, String part) {
        if (part == null || part.isBlank()) {
            return;
        }
        if (sb.length() > 0) {
            sb.append(", ");
        }
        sb.append(part.trim());
    }
}
