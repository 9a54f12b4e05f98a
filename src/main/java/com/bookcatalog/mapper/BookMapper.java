package com.bookcatalog.mapper;

import com.bookcatalog.dto.request.CreateBookRequest;
import com.bookcatalog.dto.request.UpdateBookRequest;
import com.bookcatalog.dto.response.BookResponse;
import com.bookcatalog.entity.Book;
import com.bookcatalog.util.IsbnUtils;

public final class BookMapper {

    private BookMapper() {}

    public static Book toEntity(CreateBookRequest request) {
        Book book = new Book();
        book.setTitle(request.title());
        book.setAuthor(request.author());
        book.setIsbn(IsbnUtils.normalize(request.isbn()));
        book.setPublishedYear(request.publishedYear());
        book.setDescription(request.description());
        return book;
    }

    public static BookResponse toResponse(Book book) {
        return new BookResponse(
            book.getId(),
            book.getTitle(),
            book.getAuthor(),
            book.getIsbn(),
            book.getPublishedYear(),
            book.getDescription(),
            book.getCreatedAt(),
            book.getUpdatedAt()
        );
    }

    /** Copies the non-null fields of {@code request} onto {@code book}. */
    public static void updateEntity(Book book, UpdateBookRequest request) {
        if (request.title() != null) {
            book.setTitle(request.title());
        }
        if (request.author() != null) {
            book.setAuthor(request.author());
        }
        if (request.isbn() != null) {
            book.setIsbn(IsbnUtils.normalize(request.isbn()));
        }
        if (request.publishedYear() != null) {
            book.setPublishedYear(request.publishedYear());
        }
        if (request.description() != null) {
            book.setDescription(request.description());
        }
    }
}
