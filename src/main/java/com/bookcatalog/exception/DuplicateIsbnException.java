package com.bookcatalog.exception;

/**
 * Thrown when a create or update would give a book an ISBN another book already holds.
 * The ISBN is the normalised form, so hyphenated and plain spellings collide.
 */
public class DuplicateIsbnException extends RuntimeException {

    private final String isbn;

    public DuplicateIsbnException(String isbn) {
        super("A book with ISBN " + isbn + " already exists");
        this.isbn = isbn;
    }

    public String getIsbn() {
        return isbn;
    }
}
