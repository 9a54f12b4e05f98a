package com.bookcatalog.dto.response;

import java.time.Instant;

public record BookResponse(
    Long id,
    String title,
    String author,
    String isbn,
    Integer publishedYear,
    String description,
    Instant createdAt,
    Instant updatedAt
) {}
