package org.example.campusschedule.service;

import org.example.campusschedule.dto.response.AnnouncementResponse;

import java.util.List;

public interface AnnouncementService {

    /**
     * Visible announcements, at most five. Falls back to static content when the store fails.
     */
    List<AnnouncementResponse> listVisible();
}
