package org.example.campusschedule.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.example.campusschedule.model.Announcement;

// fallback items have no id and no visibility flag
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnnouncementResponse {

    @JsonProperty("_id")
    private String id;
    private String title;
    private String body;
    private Boolean visible;

    public static AnnouncementResponse from(Announcement a) {
        return new AnnouncementResponse(a.getId(), a.getTitle(), a.getBody(), a.isVisible());
    }

    public static AnnouncementResponse staticItem(String title, String body) {
        return new AnnouncementResponse(null, title, body, null);
    }
}
