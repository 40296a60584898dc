package org.example.campusschedule.service;

import org.example.campusschedule.dto.request.CreateCourseRequest;
import org.example.campusschedule.dto.response.CourseResponse;
import org.example.campusschedule.dto.response.IdResponse;

import java.util.List;

public interface CourseService {
    IdResponse createCourse(CreateCourseRequest request);
    List<CourseResponse> listByOwner(String ownerEmail);
}
