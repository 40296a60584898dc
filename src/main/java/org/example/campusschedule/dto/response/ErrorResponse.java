package org.example.campusschedule.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Getter;
import lombok.Setter;

import java.util.List;

@Getter
@Setter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    private String detail;
    private List<String> errors;

    public ErrorResponse() {
    }

    public ErrorResponse(String detail) {
        this.detail = detail;
    }

    public ErrorResponse(String detail, List<String> errors) {
        this.detail = detail;
        this.errors = errors;
    }
}
