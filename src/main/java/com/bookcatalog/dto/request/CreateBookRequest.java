package com.bookcatalog.dto.request;

import com.bookcatalog.validation.Isbn;
import com.bookcatalog.validation.PublicationYear;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CreateBookRequest(

    @NotBlank(message = "Title must not be blank")
    @Size(max = 255, message = "Title must not exceed 255 characters")
    String title,

    @NotBlank(message = "Author must not be blank")
    @Size(max = 255, message = "Author must not exceed 255 characters")
    String author,

    @NotBlank(message = "ISBN must not be blank")
    @Isbn
    String isbn,

    @NotNull(message = "Published year is required")
    @PublicationYear
    Integer publishedYear,

    @Size(max = 10000, message = "Description must not exceed 10000 characters")
    String description
) {}
