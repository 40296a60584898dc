package org.example.campusschedule.repository;

import lombok.extern.slf4j.Slf4j;
import org.example.campusschedule.exception.DuplicateDocumentException;
import org.example.campusschedule.exception.ReadFailureException;
import org.example.campusschedule.exception.StoreUnavailableException;
import org.example.campusschedule.exception.WriteFailureException;
import org.example.campusschedule.model.BaseDocument;
import org.example.campusschedule.model.DocumentKind;
import org.example.campusschedule.model.IndexSpec;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Component
public class MongoDocumentStore implements DocumentStore {

    private final MongoTemplate mongoTemplate;
    private final boolean enabled;

    public MongoDocumentStore(MongoTemplate mongoTemplate,
                              @Value("${app.store.enabled:true}") boolean enabled) {
        this.mongoTemplate = mongoTemplate;
        this.enabled = enabled;
    }

    @Override
    public boolean isAvailable() {
        return enabled;
    }

    @Override
    public <T extends BaseDocument> String createDocument(DocumentKind<T> kind, T record) {
        requireAvailable();
        Instant now = Instant.now();
        record.setCreatedAt(now);
        record.setUpdatedAt(now);
        try {
            return mongoTemplate.insert(record, kind.collection()).getId();
        } catch (DuplicateKeyException e) {
            throw new DuplicateDocumentException(kind.collection(), e);
        } catch (DataAccessResourceFailureException e) {
            throw new StoreUnavailableException(e);
        } catch (DataAccessException e) {
            throw new WriteFailureException(kind.collection(), e);
        }
    }

    @Override
    public <T extends BaseDocument> List<T> findDocuments(DocumentKind<T> kind, Map<String, Object> filter, Integer limit) {
        requireAvailable();
        Query query = toQuery(filter);
        if (limit != null) {
            query.limit(limit);
        }
        try {
            return mongoTemplate.find(query, kind.type(), kind.collection());
        } catch (DataAccessResourceFailureException e) {
            throw new StoreUnavailableException(e);
        } catch (DataAccessException e) {
            throw new ReadFailureException(kind.collection(), e);
        }
    }

    @Override
    public <T extends BaseDocument> Optional<T> findOne(DocumentKind<T> kind, Map<String, Object> filter) {
        requireAvailable();
        try {
            return Optional.ofNullable(mongoTemplate.findOne(toQuery(filter), kind.type(), kind.collection()));
        } catch (DataAccessResourceFailureException e) {
            throw new StoreUnavailableException(e);
        } catch (DataAccessException e) {
            throw new ReadFailureException(kind.collection(), e);
        }
    }

    @Override
    public <T extends BaseDocument> long updateFields(DocumentKind<T> kind, Map<String, Object> filter, Map<String, Object> fields) {
        requireAvailable();
        Update update = new Update();
        fields.forEach(update::set);
        update.set("updatedAt", Instant.now());
        try {
            return mongoTemplate.updateFirst(toQuery(filter), update, kind.type(), kind.collection()).getMatchedCount();
        } catch (DataAccessResourceFailureException e) {
            throw new StoreUnavailableException(e);
        } catch (DataAccessException e) {
            throw new WriteFailureException(kind.collection(), e);
        }
    }

    @Override
    public List<String> listCollectionNames() {
        requireAvailable();
        try {
            List<String> names = new ArrayList<>(mongoTemplate.getCollectionNames());
            names.sort(null);
            return names;
        } catch (DataAccessResourceFailureException e) {
            throw new StoreUnavailableException(e);
        } catch (DataAccessException e) {
            throw new ReadFailureException("*", e);
        }
    }

    @Override
    @EventListener(ApplicationReadyEvent.class)
    public void ensureIndexes() {
        if (!isAvailable()) {
            log.warn("Document store disabled, skipping index setup");
            return;
        }
        for (DocumentKind<?> kind : DocumentKind.ALL) {
            for (IndexSpec spec : kind.indexes()) {
                try {
                    String name = mongoTemplate.indexOps(kind.collection()).ensureIndex(toIndex(spec));
                    log.info("Index {} ready on {}", name, kind.collection());
                } catch (RuntimeException e) {
                    log.warn("Could not create index {} on {}: {}", spec.getFields(), kind.collection(), e.getMessage());
                }
            }
        }
    }

    private void requireAvailable() {
        if (!isAvailable()) {
            throw new StoreUnavailableException();
        }
    }

    private static Query toQuery(Map<String, Object> filter) {
        Query query = new Query();
        filter.forEach((field, value) -> query.addCriteria(Criteria.where(field).is(value)));
        return query;
    }

    private static Index toIndex(IndexSpec spec) {
        Index index = new Index();
        spec.getFields().forEach(field -> index.on(field, Sort.Direction.ASC));
        if (spec.isUnique()) {
            index.unique();
        }
        return index;
    }
}
