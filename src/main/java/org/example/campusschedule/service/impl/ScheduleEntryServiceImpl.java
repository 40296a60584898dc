package org.example.campusschedule.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.campusschedule.dto.request.CreateScheduleEntryRequest;
import org.example.campusschedule.dto.response.IdResponse;
import org.example.campusschedule.dto.response.ScheduleEntryResponse;
import org.example.campusschedule.model.DocumentKind;
import org.example.campusschedule.model.ScheduleEntry;
import org.example.campusschedule.repository.DocumentStore;
import org.example.campusschedule.service.ScheduleEntryService;
import org.example.campusschedule.validation.DocumentValidator;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduleEntryServiceImpl implements ScheduleEntryService {

    private final DocumentStore store;
    private final DocumentValidator validator;

    @Override
    public IdResponse createEntry(CreateScheduleEntryRequest request) {
        ScheduleEntry entry = new ScheduleEntry();
        entry.setOwnerEmail(request.getOwnerEmail());
        entry.setTitle(request.getTitle());
        entry.setDay(request.getDay());
        entry.setStartTime(request.getStartTime());
        entry.setEndTime(request.getEndTime());
        entry.setLocation(request.getLocation());
        entry.setNotes(request.getNotes());
        entry.setColor(request.getColor());
        validator.validate(DocumentKind.SCHEDULE_ENTRY, entry);

        String id = store.createDocument(DocumentKind.SCHEDULE_ENTRY, entry);
        log.info("Created schedule entry {} on {} for {}", id, entry.getDay(), entry.getOwnerEmail());
        return new IdResponse(id);
    }

    @Override
    public List<ScheduleEntryResponse> listByOwner(String ownerEmail) {
        return store.findDocuments(DocumentKind.SCHEDULE_ENTRY, Map.of("ownerEmail", ownerEmail), null).stream()
                .map(ScheduleEntryResponse::from)
                .collect(Collectors.toList());
    }
}
