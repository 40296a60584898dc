package org.example.campusschedule.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class CreateScheduleEntryRequest {

    @NotNull(message = "owner_email is required")
    private String ownerEmail;

    @NotNull(message = "title is required")
    private String title;

    @NotNull(message = "day is required")
    private String day;

    @NotNull(message = "start_time is required")
    private String startTime;

    @NotNull(message = "end_time is required")
    private String endTime;

    private String location;
    private String notes;
    private String color;
}
