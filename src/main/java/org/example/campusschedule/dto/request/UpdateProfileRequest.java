package org.example.campusschedule.dto.request;

import lombok.Getter;
import lombok.Setter;

/**
 * Partial profile update. Null fields leave the stored value untouched.
 */
@Getter
@Setter
public class UpdateProfileRequest {
    private String name;
    private String major;
    private String year;
    private String avatar;
}
