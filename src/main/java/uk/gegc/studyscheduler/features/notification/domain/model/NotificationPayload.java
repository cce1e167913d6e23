package uk.gegc.studyscheduler.features.notification.domain.model;

import java.util.Map;

public record NotificationPayload(String title, String body, String tag, String url, Map<String, String> data) {

    public NotificationPayload {
        data = data == null ? Map.of() : Map.copyOf(data);
    }
}
