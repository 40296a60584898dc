package org.example.campusschedule.dto.request;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.example.campusschedule.model.BaseDocument;

@Getter
@Setter
public class LoginRequest {

    @NotBlank(message = "email is required")
    @Email(regexp = BaseDocument.EMAIL_REGEX, message = "email is not a valid address")
    private String email;

    @NotNull(message = "password is required")
    private String password;

    public LoginRequest() {
    }

    public LoginRequest(String email, String password) {
        this.email = email;
        this.password = password;
    }
}
