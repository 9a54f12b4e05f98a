package com.bookcatalog.dto.request;

/**
 * Optional criteria for listing books. A {@code null} component is not applied.
 *
 * @param title         case-insensitive substring of the title
 * @param author        case-insensitive substring of the author
 * @param publishedYear exact publication year
 */
public record BookFilter(String title, String author, Integer publishedYear) {

    public static BookFilter none() {
        return new BookFilter(null, null, null);
    }
}
