package org.example.campusschedule.exception;

public class DuplicateDocumentException extends StoreException {

    private final String collection;

    public DuplicateDocumentException(String collection, Throwable cause) {
        super("Duplicate key in collection " + collection, cause);
        this.collection = collection;
    }

    public String getCollection() {
        return collection;
    }
}
