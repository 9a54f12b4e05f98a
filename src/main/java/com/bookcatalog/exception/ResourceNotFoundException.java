package com.bookcatalog.exception;

public class ResourceNotFoundException extends RuntimeException {

    private final Long id;

    public ResourceNotFoundException(String entityName, Long id) {
        super(entityName + " with id " + id + " was not found");
        this.id = id;
    }

    public Long getId() {
        return id;
    }
}
