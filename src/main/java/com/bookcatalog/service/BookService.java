package com.bookcatalog.service;

import com.bookcatalog.dto.request.BookFilter;
import com.bookcatalog.dto.request.CreateBookRequest;
import com.bookcatalog.dto.request.UpdateBookRequest;
import com.bookcatalog.dto.response.BookResponse;
import com.bookcatalog.entity.Book;
import com.bookcatalog.exception.DuplicateIsbnException;
import com.bookcatalog.exception.ResourceNotFoundException;
import com.bookcatalog.mapper.BookMapper;
import com.bookcatalog.repository.BookRepository;
import com.bookcatalog.repository.BookSpecifications;
import com.bookcatalog.util.IsbnUtils;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
public class BookService {

    private static final Logger log = LoggerFactory.getLogger(BookService.class);

    private final BookRepository bookRepository;

    @Transactional(readOnly = true)
    public List<BookResponse> findAll(BookFilter filter, int skip, int limit) {
        return bookRepository.findAllOrderedById(BookSpecifications.matching(filter), skip, limit)
            .stream()
            .map(BookMapper::toResponse)
            .toList();
    }

    @Transactional(readOnly = true)
    public BookResponse findById(Long id) {
        Book book = bookRepository.findById(id)
            .orElseThrow(() -> new ResourceNotFoundException("Book", id));
        return BookMapper.toResponse(book);
    }

    @Transactional
    public BookResponse create(CreateBookRequest request) {
        String isbn = IsbnUtils.normalize(request.isbn());
        if (bookRepository.existsByIsbn(isbn)) {
            throw new DuplicateIsbnException(isbn);
        }

        Book saved = bookRepository.save(BookMapper.toEntity(request));
        log.info("Created book id={} isbn={}", saved.getId(), saved.getIsbn());
        return BookMapper.toResponse(saved);
    }

    @Transactional
    public BookResponse update(Long id, UpdateBookRequest request) {
        Book book = bookRepository.findByIdForUpdate(id)
            .orElseThrow(() -> new ResourceNotFoundException("Book", id));

        String isbn = IsbnUtils.normalize(request.isbn());
        if (isbn != null && !isbn.equals(book.getIsbn())
                && bookRepository.existsByIsbnAndIdNot(isbn, id)) {
            throw new DuplicateIsbnException(isbn);
        }

        BookMapper.updateEntity(book, request);

        Book saved = bookRepository.saveAndFlush(book);
        log.info("Updated book id={}", saved.getId());
        return BookMapper.toResponse(saved);
    }

    @Transactional
    public void delete(Long id) {
        Book book = bookRepository.findByIdForUpdate(id)
            .orElseThrow(() -> new ResourceNotFoundException("Book", id));

        bookRepository.delete(book);
        log.info("Deleted book id={}", id);
    }
}
