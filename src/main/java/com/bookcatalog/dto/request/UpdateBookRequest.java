package com.bookcatalog.dto.request;

import com.bookcatalog.validation.Isbn;
import com.bookcatalog.validation.PublicationYear;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Body of PUT and PATCH requests. Every field is optional; {@code null} means
 * "leave unchanged". Supplied text fields must still be non-blank.
 */
public record UpdateBookRequest(

    @Pattern(regexp = "(?s).*\\S.*", message = "Title must not be blank")
    @Size(max = 255, message = "Title must not exceed 255 characters")
    String title,

    @Pattern(regexp = "(?s).*\\S.*", message = "Author must not be blank")
    @Size(max = 255, message = "Author must not exceed 255 characters")
    String author,

    @Isbn
    String isbn,

    @PublicationYear
    Integer publishedYear,

    @Size(max = 10000, message = "Description must not exceed 10000 characters")
    String description
) {}
