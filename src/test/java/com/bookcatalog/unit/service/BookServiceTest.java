package com.bookcatalog.unit.service;

import com.bookcatalog.dto.request.BookFilter;
import com.bookcatalog.dto.request.CreateBookRequest;
import com.bookcatalog.dto.request.UpdateBookRequest;
import com.bookcatalog.dto.response.BookResponse;
import com.bookcatalog.entity.Book;
import com.bookcatalog.exception.DuplicateIsbnException;
import com.bookcatalog.exception.ResourceNotFoundException;
import com.bookcatalog.repository.BookRepository;
import com.bookcatalog.service.BookService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BookServiceTest {

    @Mock
    private BookRepository bookRepository;

    @InjectMocks
    private BookService bookService;

    @Test
    void createBook_withValidRequest_returnsBookResponseWithAssignedId() {
        when(bookRepository.existsByIsbn("9780441172719")).thenReturn(false);
        when(bookRepository.save(any(Book.class))).thenAnswer(invocation -> {
            Book saved = invocation.getArgument(0);
            ReflectionTestUtils.setField(saved, "id", 1L);
            return saved;
        });

        var request = new CreateBookRequest("Dune", "Frank Herbert", "9780441172719", 1965, null);
        BookResponse response = bookService.create(request);

        assertThat(response.id()).isEqualTo(1L);
        assertThat(response.title()).isEqualTo("Dune");
        assertThat(response.author()).isEqualTo("Frank Herbert");
        assertThat(response.isbn()).isEqualTo("9780441172719");
        assertThat(response.publishedYear()).isEqualTo(1965);
        assertThat(response.description()).isNull();
    }

    @Test
    void createBook_withHyphenatedIsbn_storesNormalizedIsbn() {
        when(bookRepository.existsByIsbn("9780441172719")).thenReturn(false);
        when(bookRepository.save(any(Book.class))).thenAnswer(inv -> inv.getArgument(0));

        var request = new CreateBookRequest("Dune", "Frank Herbert", "978-0-441-17271-9", 1965, null);
        bookService.create(request);

        ArgumentCaptor<Book> captor = ArgumentCaptor.forClass(Book.class);
        verify(bookRepository).save(captor.capture());
        assertThat(captor.getValue().getIsbn()).isEqualTo("9780441172719");
    }

    @Test
    void createBook_withDuplicateIsbn_throwsDuplicateIsbnException() {
        when(bookRepository.existsByIsbn("9780441172719")).thenReturn(true);

        var request = new CreateBookRequest("Dune", "Frank Herbert", "9780441172719", 1965, null);

        assertThatThrownBy(() -> bookService.create(request))
            .isInstanceOf(DuplicateIsbnException.class)
            .hasMessageContaining("9780441172719");

        verify(bookRepository, never()).save(any());
    }

    @Test
    void createBook_withHyphenatedDuplicate_reportsNormalizedIsbn() {
        when(bookRepository.existsByIsbn("9780441172719")).thenReturn(true);

        var request = new CreateBookRequest("Dune", "Frank Herbert", "978-0-441-17271-9", 1965, null);

        assertThatThrownBy(() -> bookService.create(request))
            .isInstanceOfSatisfying(DuplicateIsbnException.class,
                ex -> assertThat(ex.getIsbn()).isEqualTo("9780441172719"));
    }

    @Test
    void findById_whenFound_returnsBookResponse() {
        Book book = createTestBook(1L, "Dune", "9780441172719");
        when(bookRepository.findById(1L)).thenReturn(Optional.of(book));

        BookResponse response = bookService.findById(1L);

        assertThat(response.id()).isEqualTo(1L);
        assertThat(response.title()).isEqualTo("Dune");
    }

    @Test
    void findById_whenNotFound_throwsResourceNotFoundException() {
        when(bookRepository.findById(99L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> bookService.findById(99L))
            .isInstanceOf(ResourceNotFoundException.class)
            .hasMessageContaining("Book")
            .hasMessageContaining("99");
    }

    @Test
    void findAll_passesWindowToRepository() {
        Book first = createTestBook(1L, "Dune", "9780441172719");
        Book second = createTestBook(2L, "Emma", "9780141439587");
        when(bookRepository.findAllOrderedById(any(), eq(0), eq(100))).thenReturn(List.of(first, second));

        List<BookResponse> result = bookService.findAll(BookFilter.none(), 0, 100);

        assertThat(result).extracting(BookResponse::title).containsExactly("Dune", "Emma");
    }

    @Test
    void findAll_whenNothingMatches_returnsEmptyList() {
        when(bookRepository.findAllOrderedById(any(), eq(5), eq(10))).thenReturn(List.of());

        assertThat(bookService.findAll(new BookFilter("nothing", null, null), 5, 10)).isEmpty();
    }

    @Test
    void updateBook_withTitleOnly_changesOnlyTitle() {
        Book book = createTestBook(1L, "Dune", "9780441172719");
        book.setDescription("Desert planet");
        when(bookRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(book));
        when(bookRepository.saveAndFlush(any(Book.class))).thenAnswer(inv -> inv.getArgument(0));

        var request = new UpdateBookRequest("Dune Messiah", null, null, null, null);
        BookResponse response = bookService.update(1L, request);

        assertThat(response.title()).isEqualTo("Dune Messiah");
        assertThat(response.author()).isEqualTo("Frank Herbert");
        assertThat(response.isbn()).isEqualTo("9780441172719");
        assertThat(response.publishedYear()).isEqualTo(1965);
        assertThat(response.description()).isEqualTo("Desert planet");
        verify(bookRepository, never()).existsByIsbnAndIdNot(anyString(), any());
    }

    @Test
    void updateBook_withOwnIsbn_doesNotCheckForConflict() {
        Book book = createTestBook(1L, "Dune", "9780441172719");
        when(bookRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(book));
        when(bookRepository.saveAndFlush(any(Book.class))).thenAnswer(inv -> inv.getArgument(0));

        bookService.update(1L, new UpdateBookRequest(null, null, "978-0441172719", null, null));

        verify(bookRepository, never()).existsByIsbnAndIdNot(anyString(), any());
    }

    @Test
    void updateBook_withIsbnOfAnotherBook_throwsDuplicateIsbnException() {
        Book book = createTestBook(1L, "Dune", "9780441172719");
        when(bookRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(book));
        when(bookRepository.existsByIsbnAndIdNot("9780141439587", 1L)).thenReturn(true);

        var request = new UpdateBookRequest(null, null, "9780141439587", null, null);

        assertThatThrownBy(() -> bookService.update(1L, request))
            .isInstanceOf(DuplicateIsbnException.class);

        verify(bookRepository, never()).saveAndFlush(any());
        assertThat(book.getIsbn()).isEqualTo("9780441172719");
    }

    @Test
    void updateBook_whenNotFound_throwsResourceNotFoundException() {
        when(bookRepository.findByIdForUpdate(99L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> bookService.update(99L, new UpdateBookRequest(null, null, null, null, null)))
            .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void deleteBook_whenFound_deletesSuccessfully() {
        Book book = createTestBook(1L, "Dune", "9780441172719");
        when(bookRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(book));

        bookService.delete(1L);

        verify(bookRepository).delete(book);
    }

    @Test
    void deleteBook_whenNotFound_throwsResourceNotFoundException() {
        when(bookRepository.findByIdForUpdate(99L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> bookService.delete(99L))
            .isInstanceOf(ResourceNotFoundException.class);

        verify(bookRepository, never()).delete(any());
    }

    private Book createTestBook(Long id, String title, String isbn) {
        Book book = new Book();
        ReflectionTestUtils.setField(book, "id", id);
        book.setTitle(title);
        book.setAuthor("Frank Herbert");
        book.setIsbn(isbn);
        book.setPublishedYear(1965);
        return book;
    }
}
