package uk.gegc.studyscheduler.features.notification.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import uk.gegc.studyscheduler.features.notification.application.NotificationDispatcher;
import uk.gegc.studyscheduler.features.notification.application.impl.LoggingNotificationDispatcher;

@Configuration
public class NotificationConfig {

    @Bean
    @ConditionalOnMissingBean(NotificationDispatcher.class)
    public NotificationDispatcher notificationDispatcher() {
        return new LoggingNotificationDispatcher();
    }
}
