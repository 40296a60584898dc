package org.example.campusschedule.repository;

import org.example.campusschedule.model.BaseDocument;
import org.example.campusschedule.model.DocumentKind;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Generic access to the document store. Filters map document property names
 * (for example {@code ownerEmail}) to the value they must equal.
 *
 * <p>Every operation throws {@link org.example.campusschedule.exception.StoreUnavailableException}
 * when {@link #isAvailable()} is false or the backend cannot be reached.
 */
public interface DocumentStore {

    boolean isAvailable();

    /**
     * Inserts the record and returns its generated id.
     *
     * @throws org.example.campusschedule.exception.DuplicateDocumentException on a unique index violation
     * @throws org.example.campusschedule.exception.WriteFailureException on any other backend error
     */
    <T extends BaseDocument> String createDocument(DocumentKind<T> kind, T record);

    /**
     * Matching records in store order, at most {@code limit} of them when the limit is not null.
     *
     * @throws org.example.campusschedule.exception.ReadFailureException on a backend error
     */
    <T extends BaseDocument> List<T> findDocuments(DocumentKind<T> kind, Map<String, Object> filter, Integer limit);

    <T extends BaseDocument> Optional<T> findOne(DocumentKind<T> kind, Map<String, Object> filter);

    /**
     * Sets the given fields on the first matching record. Matching nothing is not an error.
     *
     * @return number of matched records, 0 or 1
     */
    <T extends BaseDocument> long updateFields(DocumentKind<T> kind, Map<String, Object> filter, Map<String, Object> fields);

    List<String> listCollectionNames();

    /**
     * Creates the indexes declared by every {@link DocumentKind}. Failures are logged, never thrown.
     */
    void ensureIndexes();
}
