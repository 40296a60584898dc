package org.example.campusschedule.model;

import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.data.mongodb.core.mapping.Document;

@Document(collection = "announcement")
@Getter
@Setter
public class Announcement extends BaseDocument {

    @NotNull
    private String title;

    @NotNull
    private String body;

    private boolean visible = true;

    public Announcement() {}

    public Announcement(String title, String body, boolean visible) {
        this.title = title;
        this.body = body;
        this.visible = visible;
    }
}
