package com.bookcatalog.controller;

import com.bookcatalog.dto.request.BookFilter;
import com.bookcatalog.dto.request.CreateBookRequest;
import com.bookcatalog.dto.request.UpdateBookRequest;
import com.bookcatalog.dto.response.BookResponse;
import com.bookcatalog.service.BookService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

import java.net.URI;
import java.util.List;

@RestController
@RequestMapping("/api/v1/books")
@RequiredArgsConstructor
@Tag(name = "Books", description = "Book catalog operations")
public class BookController {

    private final BookService bookService;

    @GetMapping
    @Operation(summary = "List books", description = "Returns books ordered by id. Optional filters are combined with AND.")
    @ApiResponse(responseCode = "200", description = "Books matching the filters (possibly empty)")
    @ApiResponse(responseCode = "422", description = "Invalid skip/limit")
    public ResponseEntity<List<BookResponse>> findAll(
            @Parameter(description = "Number of records to skip")
            @RequestParam(defaultValue = "0") @Min(0) int skip,
            @Parameter(description = "Maximum number of records to return")
            @RequestParam(defaultValue = "100") @Min(1) @Max(1000) int limit,
            @Parameter(description = "Case-insensitive title substring")
            @RequestParam(required = false) String title,
            @Parameter(description = "Case-insensitive author substring")
            @RequestParam(required = false) String author,
            @Parameter(description = "Exact publication year")
            @RequestParam(name = "published_year", required = false) Integer publishedYear) {
        BookFilter filter = new BookFilter(title, author, publishedYear);
        return ResponseEntity.ok(bookService.findAll(filter, skip, limit));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get book by ID")
    @ApiResponse(responseCode = "200", description = "Book found")
    @ApiResponse(responseCode = "404", description = "Book not found")
    public ResponseEntity<BookResponse> findById(@PathVariable Long id) {
        return ResponseEntity.ok(bookService.findById(id));
    }

    @PostMapping
    @Operation(summary = "Create a new book", description = "ISBN must be a unique ISBN-10 or ISBN-13; hyphens are ignored.")
    @ApiResponse(responseCode = "201", description = "Book created")
    @ApiResponse(responseCode = "409", description = "ISBN already exists")
    @ApiResponse(responseCode = "422", description = "Validation error")
    public ResponseEntity<BookResponse> create(@Valid @RequestBody CreateBookRequest request) {
        BookResponse created = bookService.create(request);
        URI location = ServletUriComponentsBuilder.fromCurrentRequest()
            .path("/{id}")
            .buildAndExpand(created.id())
            .toUri();
        return ResponseEntity.created(location).body(created);
    }

    @PutMapping("/{id}")
    @Operation(summary = "Update a book", description = "Null or absent fields are left unchanged.")
    @ApiResponse(responseCode = "200", description = "Book updated")
    @ApiResponse(responseCode = "404", description = "Book not found")
    @ApiResponse(responseCode = "409", description = "ISBN already exists")
    @ApiResponse(responseCode = "422", description = "Validation error")
    public ResponseEntity<BookResponse> update(@PathVariable Long id,
                                               @Valid @RequestBody UpdateBookRequest request) {
        return ResponseEntity.ok(bookService.update(id, request));
    }

    @PatchMapping("/{id}")
    @Operation(summary = "Partially update a book", description = "Same semantics as PUT: only supplied fields change.")
    @ApiResponse(responseCode = "200", description = "Book updated")
    @ApiResponse(responseCode = "404", description = "Book not found")
    @ApiResponse(responseCode = "409", description = "ISBN already exists")
    @ApiResponse(responseCode = "422", description = "Validation error")
    public ResponseEntity<BookResponse> patch(@PathVariable Long id,
                                              @Valid @RequestBody UpdateBookRequest request) {
        return ResponseEntity.ok(bookService.update(id, request));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete a book")
    @ApiResponse(responseCode = "204", description = "Book deleted")
    @ApiResponse(responseCode = "404", description = "Book not found")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        bookService.delete(id);
        return ResponseEntity.noContent().build();
    }
}
