package org.example.campusschedule.model;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Getter;
import lombok.Setter;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

/**
 * A block on the weekly calendar: a class, a lab or a study session.
 * The day is kept as free text (Mon..Sun by convention) and overlapping blocks are allowed.
 */
@Document(collection = "scheduleentry")
@Getter
@Setter
public class ScheduleEntry extends BaseDocument {

    public static final String TIME_REGEX = "^([01]\\d|2[0-3]):[0-5]\\d$";

    @NotBlank
    @Email(regexp = EMAIL_REGEX)
    @Field("owner_email")
    private String ownerEmail;

    @NotBlank
    private String title;

    @NotBlank
    private String day;

    @NotNull
    @Pattern(regexp = TIME_REGEX, message = "must be a 24h HH:MM time")
    @Field("start_time")
    private String startTime;

    @NotNull
    @Pattern(regexp = TIME_REGEX, message = "must be a 24h HH:MM time")
    @Field("end_time")
    private String endTime;

    @Field(write = Field.Write.ALWAYS)
    private String location;

    @Field(write = Field.Write.ALWAYS)
    private String notes;

    // hex color for the calendar UI
    @Field(write = Field.Write.ALWAYS)
    private String color;
}
