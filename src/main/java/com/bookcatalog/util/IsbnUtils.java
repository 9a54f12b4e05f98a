package com.bookcatalog.util;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Helpers for normalising and shape-checking ISBN input before validation and persistence.
 */
public final class IsbnUtils {

    private static final Pattern ALLOWED_CHARACTERS = Pattern.compile("[0-9Xx\\- ]+");
    private static final Pattern SEPARATORS = Pattern.compile("[\\- ]");
    private static final Pattern ISBN_13 = Pattern.compile("\\d{13}");
    private static final Pattern ISBN_10 = Pattern.compile("\\d{9}[\\dX]");

    private IsbnUtils() {
    }

    /**
     * Strips hyphens and spaces and upper-cases the {@code X} check digit.
     *
     * @param raw user-provided ISBN
     * @return normalised ISBN, or {@code null} if the input is null or contains
     *         characters other than digits, {@code X}, hyphens and spaces
     */
    public static String normalize(String raw) {
        if (raw == null || !ALLOWED_CHARACTERS.matcher(raw).matches()) {
            return null;
        }
        String cleaned = SEPARATORS.matcher(raw).replaceAll("");
        return cleaned.isEmpty() ? null : cleaned.toUpperCase(Locale.ROOT);
    }

    public static boolean isValidIsbn13(String isbn) {
        String normalized = normalize(isbn);
        return normalized != null && ISBN_13.matcher(normalized).matches();
    }

    public static boolean isValidIsbn10(String isbn) {
        String normalized = normalize(isbn);
        return normalized != null && ISBN_10.matcher(normalized).matches();
    }

    public static boolean isValid(String isbn) {
        return isValidIsbn13(isbn) || isValidIsbn10(isbn);
    }
}
