package org.example.campusschedule.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.example.campusschedule.dto.request.CreateScheduleEntryRequest;
import org.example.campusschedule.dto.response.IdResponse;
import org.example.campusschedule.dto.response.ScheduleEntryResponse;
import org.example.campusschedule.service.ScheduleEntryService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/schedule")
@RequiredArgsConstructor
public class ScheduleController {

    private final ScheduleEntryService scheduleEntryService;

    @PostMapping
    public ResponseEntity<IdResponse> add(@Valid @RequestBody CreateScheduleEntryRequest request) {
        return ResponseEntity.ok(scheduleEntryService.createEntry(request));
    }

    @GetMapping("/{ownerEmail}")
    public ResponseEntity<List<ScheduleEntryResponse>> list(@PathVariable String ownerEmail) {
        return ResponseEntity.ok(scheduleEntryService.listByOwner(ownerEmail));
    }
}
