package org.example.campusschedule.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.campusschedule.dto.response.AnnouncementResponse;
import org.example.campusschedule.model.DocumentKind;
import org.example.campusschedule.repository.DocumentStore;
import org.example.campusschedule.service.AnnouncementService;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class AnnouncementServiceImpl implements AnnouncementService {

    static final int FEED_LIMIT = 5;

    static final List<AnnouncementResponse> FALLBACK = List.of(
            AnnouncementResponse.staticItem("Welcome to Campus Scheduler",
                    "Plan classes, labs, study sessions in one place."),
            AnnouncementResponse.staticItem("Tip",
                    "Drag across the grid to create a block of study time.")
    );

    private final DocumentStore store;

    @Override
    public List<AnnouncementResponse> listVisible() {
        try {
            return store.findDocuments(DocumentKind.ANNOUNCEMENT, Map.of("visible", true), FEED_LIMIT).stream()
                    .map(AnnouncementResponse::from)
                    .collect(Collectors.toList());
        } catch (RuntimeException e) {
            // any failure, including unmappable documents, falls back to the static feed
            log.warn("Serving fallback announcements: {}", e.toString());
            return FALLBACK;
        }
    }
}
