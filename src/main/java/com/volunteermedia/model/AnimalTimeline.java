package com.volunteermedia.model;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.Period;
import java.time.ZoneOffset;

/**
 * Date arithmetic for animal profiles. Pure functions over an explicit "now"
 * so the rules can be checked without a clock.
 */
public final class AnimalTimeline {

    /** Bite quarantine lasts ten days and never ends on a weekend. */
    public static final int QUARANTINE_DAYS = 10;

    private AnimalTimeline() {
    }

    public static LocalDate quarantineEndDate(LocalDate quarantineStart) {
        if (quarantineStart == null) {
            return null;
        }
        LocalDate end = quarantineStart.plusDays(QUARANTINE_DAYS);
        while (end.getDayOfWeek() == DayOfWeek.SATURDAY || end.getDayOfWeek() == DayOfWeek.SUNDAY) {
            end = end.plusDays(1);
        }
        return end;
    }

    public static long daysSince(Instant since, Instant now) {
        if (since == null) {
            return 0;
        }
        return Math.max(0, Duration.between(since, now).toDays());
    }

    public static AgeDisplay ageDisplay(LocalDate birthDate, Integer fallbackYears, LocalDate today) {
        if (birthDate == null) {
            return new AgeDisplay(fallbackYears == null ? 0 : fallbackYears, 0);
        }
        if (birthDate.isAfter(today)) {
            return new AgeDisplay(0, 0);
        }
        Period period = Period.between(birthDate, today);
        return new AgeDisplay(period.getYears(), period.getMonths());
    }

    public static LocalDate toDate(Instant instant) {
        return instant == null ? null : instant.atZone(ZoneOffset.UTC).toLocalDate();
    }

    public record AgeDisplay(int years, int months) {
    }
}
