package com.taskchat.storage;

/**
 * Raised when no row with the given id exists for the requesting owner. A row
 * owned by somebody else is reported exactly like a missing one.
 */
public class NotFoundException extends RuntimeException {

    private final String entity;
    private final String id;

    public NotFoundException(String entity, String id) {
        super(entity + " not found: " + id);
        this.entity = entity;
        this.id = id;
    }

    public String getEntity() {
        return entity;
    }

    public String getId() {
        return id;
    }
}
