package org.example.campusschedule.model;

import java.util.List;

/**
 * Registry of the persisted entity kinds. Each kind ties a document class (which also carries
 * the validation constraints) to its collection and the indexes the store keeps on it.
 *
 * @param <T> document class stored under this kind
 */
public final class DocumentKind<T extends BaseDocument> {

    public static final DocumentKind<User> USER =
            new DocumentKind<>("user", User.class, List.of(IndexSpec.unique("email")));

    public static final DocumentKind<Course> COURSE =
            new DocumentKind<>("course", Course.class, List.of(IndexSpec.on("owner_email")));

    public static final DocumentKind<ScheduleEntry> SCHEDULE_ENTRY =
            new DocumentKind<>("scheduleentry", ScheduleEntry.class, List.of(IndexSpec.on("owner_email", "day")));

    public static final DocumentKind<Announcement> ANNOUNCEMENT =
            new DocumentKind<>("announcement", Announcement.class, List.of());

    public static final List<DocumentKind<?>> ALL = List.of(USER, COURSE, SCHEDULE_ENTRY, ANNOUNCEMENT);

    private final String collection;
    private final Class<T> type;
    private final List<IndexSpec> indexes;

    private DocumentKind(String collection, Class<T> type, List<IndexSpec> indexes) {
        this.collection = collection;
        this.type = type;
        this.indexes = indexes;
    }

    public String collection() {
        return collection;
    }

    public Class<T> type() {
        return type;
    }

    public List<IndexSpec> indexes() {
        return indexes;
    }

    @Override
    public String toString() {
        return collection;
    }
}
