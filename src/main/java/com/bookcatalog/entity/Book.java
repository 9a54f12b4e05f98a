package com.bookcatalog.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity representing a catalogued book.
 *
 * <p>{@code id} is assigned by the database identity column on insert and has no
 * setter; it never changes afterwards.
 *
 * <p><strong>ISBN uniqueness</strong>: enforced by the unique index
 * {@code idx_books_isbn} (V1 migration). {@code BookService} pre-checks for
 * duplicates to produce a descriptive 409; the index remains the authority when two
 * creates race, and {@code GlobalExceptionHandler} recognises its name in the
 * resulting {@code DataIntegrityViolationException}. The stored value is always the
 * normalised form (digits plus an optional trailing {@code X}).
 *
 * <p>Equality is based on the database-assigned primary key only.
 */
@Entity
@Table(name = "books")
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id", callSuper = false)
public class Book extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Setter(AccessLevel.NONE)
    private Long id;

    @Column(name = "title", nullable = false, length = 255)
    private String title;

    @Column(name = "author", nullable = false, length = 255)
    private String author;

    @Column(name = "isbn", nullable = false, unique = true, length = 13)
    private String isbn;

    /** Publication year (year only, not a full date). */
    @Column(name = "published_year", nullable = false)
    private Integer publishedYear;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;
}
