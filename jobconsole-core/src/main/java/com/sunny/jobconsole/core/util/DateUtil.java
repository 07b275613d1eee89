package com.sunny.jobconsole.core.util;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Date;

/**
 * @author Sunny
 * @version 1.0.0
 * @since 2025-12-08
 */
public class DateUtil {

    public static final String DATETIME_FORMAT = "yyyy-MM-dd HH:mm:ss";
    private static final DateTimeFormatter FORMATTER = DateTimeFormatter.ofPattern(DATETIME_FORMAT);

    public static String formatDateTime(long epochMs, ZoneId zoneId) {
        return LocalDateTime.ofInstant(Instant.ofEpochMilli(epochMs), zoneId).format(FORMATTER);
    }

    public static long toEpochMilli(Date date) {
        return date == null ? 0 : date.getTime();
    }

}
