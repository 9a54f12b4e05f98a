package com.bookcatalog.repository;

import com.bookcatalog.dto.request.BookFilter;
import com.bookcatalog.entity.Book;
import org.springframework.data.jpa.domain.Specification;

import java.util.Locale;

public final class BookSpecifications {

    private BookSpecifications() {}

    public static Specification<Book> matching(BookFilter filter) {
        Specification<Book> spec = Specification.where(null);

        if (hasText(filter.title())) {
            spec = spec.and(containsIgnoreCase("title", filter.title()));
        }
        if (hasText(filter.author())) {
            spec = spec.and(containsIgnoreCase("author", filter.author()));
        }
        if (filter.publishedYear() != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("publishedYear"), filter.publishedYear()));
        }
        return spec;
    }

    private static Specification<Book> containsIgnoreCase(String attribute, String value) {
        String pattern = "%" + escapeLike(value.trim().toLowerCase(Locale.ROOT)) + "%";
        return (root, query, cb) -> cb.like(cb.lower(root.<String>get(attribute)), pattern, '\\');
    }

    private static String escapeLike(String value) {
        return value.replace("\\", "\\\\")
            .replace("%", "\\%")
            .replace("_", "\\_");
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
