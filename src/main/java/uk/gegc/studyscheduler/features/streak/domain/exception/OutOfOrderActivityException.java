package uk.gegc.studyscheduler.features.streak.domain.exception;

import lombok.Getter;

import java.time.LocalDate;

@Getter
public class OutOfOrderActivityException extends RuntimeException {

    private final LocalDate lastActivityDate;
    private final LocalDate activityDate;

    public OutOfOrderActivityException(LocalDate lastActivityDate, LocalDate activityDate) {
        super("Activity on " + activityDate + " predates last recorded activity on " + lastActivityDate);
        this.lastActivityDate = lastActivityDate;
        this.activityDate = activityDate;
    }
}
