package org.example.campusschedule.dto.request;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.example.campusschedule.model.BaseDocument;

@Getter
@Setter
public class RegisterRequest {

    @NotNull(message = "name is required")
    private String name;

    @NotBlank(message = "email is required")
    @Email(regexp = BaseDocument.EMAIL_REGEX, message = "email is not a valid address")
    private String email;

    @NotNull(message = "password is required")
    private String password;

    private String major;

    private String year;

    public RegisterRequest() {
    }

    public RegisterRequest(String name, String email, String password, String major, String year) {
        this.name = name;
        this.email = email;
        this.password = password;
        this.major = major;
        this.year = year;
    }
}
