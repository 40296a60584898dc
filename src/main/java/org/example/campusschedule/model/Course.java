package org.example.campusschedule.model;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

@Document(collection = "course")
@Getter
@Setter
public class Course extends BaseDocument {

    @NotBlank
    private String code;

    @NotBlank
    private String title;

    @Field(write = Field.Write.ALWAYS)
    private String instructor;

    @Field(write = Field.Write.ALWAYS)
    @Min(0)
    @Max(10)
    private Integer credits;

    @NotBlank
    @Email(regexp = EMAIL_REGEX)
    @Field("owner_email")
    private String ownerEmail;
}
