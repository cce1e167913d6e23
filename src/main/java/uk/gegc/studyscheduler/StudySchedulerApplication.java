package uk.gegc.studyscheduler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StudySchedulerApplication {

    public static void main(String[] args) {
        SpringApplication.run(StudySchedulerApplication.class, args);
    }
}
