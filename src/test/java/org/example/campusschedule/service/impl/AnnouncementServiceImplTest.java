package org.example.campusschedule.service.impl;

import org.example.campusschedule.dto.response.AnnouncementResponse;
import org.example.campusschedule.model.Announcement;
import org.example.campusschedule.model.DocumentKind;
import org.example.campusschedule.repository.DocumentStore;
import org.example.campusschedule.repository.MongoDocumentStore;
import org.example.campusschedule.exception.ReadFailureException;
import org.example.campusschedule.support.InMemoryDocumentStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.convert.ConverterNotFoundException;
import org.springframework.core.convert.TypeDescriptor;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AnnouncementServiceImplTest {

    private InMemoryDocumentStore store;
    private AnnouncementServiceImpl service;

    @BeforeEach
    void setUp() {
        store = new InMemoryDocumentStore();
        service = new AnnouncementServiceImpl(store);
    }

    @Test
    void returnsAtMostFiveVisibleAnnouncements() {
        for (int i = 0; i < 7; i++) {
            store.createDocument(DocumentKind.ANNOUNCEMENT, new Announcement("News " + i, "Body " + i, true));
        }

        List<AnnouncementResponse> feed = service.listVisible();

        assertEquals(5, feed.size());
        assertThat(feed).allMatch(a -> a.getId() != null && Boolean.TRUE.equals(a.getVisible()));
    }

    @Test
    void hiddenAnnouncementsAreNotListed() {
        store.createDocument(DocumentKind.ANNOUNCEMENT, new Announcement("Public", "shown", true));
        store.createDocument(DocumentKind.ANNOUNCEMENT, new Announcement("Draft", "hidden", false));

        List<AnnouncementResponse> feed = service.listVisible();

        assertThat(feed).extracting(AnnouncementResponse::getTitle).containsExactly("Public");
    }

    @Test
    void unavailableStoreServesStaticFallback() {
        store.setAvailable(false);

        List<AnnouncementResponse> feed = service.listVisible();

        assertEquals(AnnouncementServiceImpl.FALLBACK, feed);
        assertThat(feed).extracting(AnnouncementResponse::getTitle).containsExactly("Welcome to Campus Scheduler", "Tip");
        assertThat(feed).allMatch(a -> a.getId() == null);
    }

    @Test
    void readFailureAlsoServesFallback() {
        DocumentStore failing = mock(DocumentStore.class);
        when(failing.findDocuments(eq(DocumentKind.ANNOUNCEMENT), any(), any()))
                .thenThrow(new ReadFailureException("announcement", new RuntimeException("cursor killed")));

        assertEquals(2, new AnnouncementServiceImpl(failing).listVisible().size());
    }

    @Test
    void unmappableStoredAnnouncementServesFallback() {
        MongoTemplate template = mock(MongoTemplate.class);
        when(template.find(any(Query.class), eq(Announcement.class), eq("announcement")))
                .thenThrow(new ConverterNotFoundException(TypeDescriptor.valueOf(String.class), TypeDescriptor.valueOf(Boolean.class)));

        List<AnnouncementResponse> feed = new AnnouncementServiceImpl(new MongoDocumentStore(template, true)).listVisible();

        assertEquals(AnnouncementServiceImpl.FALLBACK, feed);
    }
}
