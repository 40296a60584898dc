package org.example.campusschedule.service;

import org.example.campusschedule.dto.request.CreateScheduleEntryRequest;
import org.example.campusschedule.dto.response.IdResponse;
import org.example.campusschedule.dto.response.ScheduleEntryResponse;

import java.util.List;

public interface ScheduleEntryService {
    IdResponse createEntry(CreateScheduleEntryRequest request);
    List<ScheduleEntryResponse> listByOwner(String ownerEmail);
}
