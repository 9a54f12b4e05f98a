package com.bookcatalog.repository;

import com.bookcatalog.entity.Book;
import org.springframework.data.jpa.domain.Specification;

import java.util.List;

/**
 * Listing query that takes a raw offset/limit window instead of a page number.
 */
public interface BookRepositoryCustom {

    /**
     * Returns books matching {@code spec}, ordered by id ascending.
     *
     * @param spec  filter to apply; may be {@code null} for no filtering
     * @param skip  number of matching rows to skip
     * @param limit maximum number of rows to return
     */
    List<Book> findAllOrderedById(Specification<Book> spec, int skip, int limit);
}
