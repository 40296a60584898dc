package org.example.campusschedule.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.example.campusschedule.model.ScheduleEntry;

import java.time.Instant;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleEntryResponse {

    @JsonProperty("_id")
    private String id;
    private String ownerEmail;
    private String title;
    private String day;
    private String startTime;
    private String endTime;
    private String location;
    private String notes;
    private String color;
    private Instant createdAt;
    private Instant updatedAt;

    public static ScheduleEntryResponse from(ScheduleEntry e) {
        return new ScheduleEntryResponse(e.getId(), e.getOwnerEmail(), e.getTitle(), e.getDay(),
                e.getStartTime(), e.getEndTime(), e.getLocation(), e.getNotes(), e.getColor(),
                e.getCreatedAt(), e.getUpdatedAt());
    }
}
