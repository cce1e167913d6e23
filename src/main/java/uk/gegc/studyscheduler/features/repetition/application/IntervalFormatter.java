package uk.gegc.studyscheduler.features.repetition.application;

public final class IntervalFormatter {

    private IntervalFormatter() {
    }

    public static String format(int days) {
        if (days < 1) return "Today";
        if (days == 1) return "1 day";
        if (days < 30) return days + " days";
        if (days < 365) {
            long months = Math.round(days / 30.0);
            return months == 1 ? "1 month" : months + " months";
        }
        long years = Math.round(days / 365.0);
        return years == 1 ? "1 year" : years + " years";
    }
}
