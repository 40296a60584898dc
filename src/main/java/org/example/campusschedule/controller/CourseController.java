package org.example.campusschedule.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.example.campusschedule.dto.request.CreateCourseRequest;
import org.example.campusschedule.dto.response.CourseResponse;
import org.example.campusschedule.dto.response.IdResponse;
import org.example.campusschedule.service.CourseService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/courses")
@RequiredArgsConstructor
public class CourseController {

    private final CourseService courseService;

    @PostMapping
    public ResponseEntity<IdResponse> create(@Valid @RequestBody CreateCourseRequest request) {
        return ResponseEntity.ok(courseService.createCourse(request));
    }

    @GetMapping("/{ownerEmail}")
    public ResponseEntity<List<CourseResponse>> list(@PathVariable String ownerEmail) {
        return ResponseEntity.ok(courseService.listByOwner(ownerEmail));
    }
}
