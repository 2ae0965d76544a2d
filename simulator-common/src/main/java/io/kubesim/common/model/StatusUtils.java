/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.common.model;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Utility methods for working with the timestamps used in metadata and status sections
 */
public class StatusUtils {
    private StatusUtils() { }

    /**
     * Returns the timestamp of the provided date in ISO 8601 format, for example "2019-07-23T09:08:12Z".
     *
     * @param instant The date instant for which should the ISO 8601 timestamp be provided
     *
     * @return the timestamp in ISO 8601 format
     */
    public static String iso8601(Instant instant) {
        return ZonedDateTime.ofInstant(instant, ZoneOffset.UTC).format(DateTimeFormatter.ISO_INSTANT);
    }

    /**
     * Returns an Instant from a string date in ISO 8601 format
     *
     * @param date a string representing a date, for example "2019-07-23T09:08:12Z"
     *
     * @return an Instant
     */
    public static Instant isoUtcDatetime(String date)  {
        return Instant.parse(date);
    }

    /**
     * Checks whether a condition status string means True
     *
     * @param status    Status of the condition (True, False or Unknown)
     *
     * @return  True if the status is "True"
     */
    public static boolean isTrue(String status) {
        return "True".equals(status);
    }
}
