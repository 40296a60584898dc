package org.example.campusschedule.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.campusschedule.dto.request.CreateCourseRequest;
import org.example.campusschedule.dto.response.CourseResponse;
import org.example.campusschedule.dto.response.IdResponse;
import org.example.campusschedule.model.Course;
import org.example.campusschedule.model.DocumentKind;
import org.example.campusschedule.repository.DocumentStore;
import org.example.campusschedule.service.CourseService;
import org.example.campusschedule.validation.DocumentValidator;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class CourseServiceImpl implements CourseService {

    private final DocumentStore store;
    private final DocumentValidator validator;

    @Override
    public IdResponse createCourse(CreateCourseRequest request) {
        Course course = new Course();
        course.setCode(request.getCode());
        course.setTitle(request.getTitle());
        course.setInstructor(request.getInstructor());
        course.setCredits(request.getCredits());
        course.setOwnerEmail(request.getOwnerEmail());
        validator.validate(DocumentKind.COURSE, course);

        String id = store.createDocument(DocumentKind.COURSE, course);
        log.info("Created course {} ({}) for {}", course.getCode(), id, course.getOwnerEmail());
        return new IdResponse(id);
    }

    @Override
    public List<CourseResponse> listByOwner(String ownerEmail) {
        return store.findDocuments(DocumentKind.COURSE, Map.of("ownerEmail", ownerEmail), null).stream()
                .map(CourseResponse::from)
                .collect(Collectors.toList());
    }
}
