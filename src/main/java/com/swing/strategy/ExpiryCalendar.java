package com.swing.strategy;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;

/**
 * Weekly option expiry: the next Thursday, a full week out when today is Thursday.
 */
public final class ExpiryCalendar {

    private static final DateTimeFormatter LABEL = DateTimeFormatter.ofPattern("dd MMM ''yy", Locale.ENGLISH);

    private ExpiryCalendar() {
    }

    public static LocalDate nextWeeklyExpiry(LocalDate today) {
        return today.with(TemporalAdjusters.next(DayOfWeek.THURSDAY));
    }

    public static String label(LocalDate expiry) {
        return expiry.format(LABEL);
    }
}
