package org.example.campusschedule.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class CreateCourseRequest {

    @NotNull(message = "code is required")
    private String code;

    @NotNull(message = "title is required")
    private String title;

    private String instructor;

    private Integer credits;

    @NotNull(message = "owner_email is required")
    private String ownerEmail;
}
