package org.example.campusschedule.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.example.campusschedule.model.Course;

import java.time.Instant;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class CourseResponse {

    @JsonProperty("_id")
    private String id;
    private String code;
    private String title;
    private String instructor;
    private Integer credits;
    private String ownerEmail;
    private Instant createdAt;
    private Instant updatedAt;

    public static CourseResponse from(Course c) {
        return new CourseResponse(c.getId(), c.getCode(), c.getTitle(), c.getInstructor(), c.getCredits(),
                c.getOwnerEmail(), c.getCreatedAt(), c.getUpdatedAt());
    }
}
