package org.example.campusschedule.model;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.Setter;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

@Document(collection = "user")
@Getter
@Setter
public class User extends BaseDocument {

    @NotNull
    @Size(min = 2, max = 80)
    private String name;

    @NotBlank
    @Email(regexp = EMAIL_REGEX)
    private String email;

    // SHA-256, lowercase hex
    @NotNull
    @Pattern(regexp = "^[0-9a-f]{64}$", message = "must be a SHA-256 hex digest")
    @Field("password_hash")
    private String passwordHash;

    @Field(write = Field.Write.ALWAYS)
    @Size(max = 80)
    private String major;

    @Field(write = Field.Write.ALWAYS)
    private String year;

    @Field(write = Field.Write.ALWAYS)
    private String avatar;

    public User() {}

    public User(String name, String email, String passwordHash, String major, String year) {
        this.name = name;
        this.email = email;
        this.passwordHash = passwordHash;
        this.major = major;
        this.year = year;
    }
}
