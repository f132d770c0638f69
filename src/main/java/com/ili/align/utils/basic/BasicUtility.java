package com.ili.align.utils.basic;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;


@Slf4j
public final class BasicUtility {
    private static final double DAYS_PER_YEAR = 365.25;
    private static final ObjectMapper om = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private BasicUtility() {
        throw new UnsupportedOperationException("Not supported");
    }

    public static String stringifyObject(Object o) {
        try {
            return om.writeValueAsString(o);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed stringifying object", e);
        }
    }

    /**
     * Fractional years between two inspection dates, or {@code fallbackYears} if either is missing.
     */
    public static double yearsBetween(LocalDate from, LocalDate to, double fallbackYears) {
        if (from == null || to == null) {
            log.debug("Inspection date missing, using nominal interval of {} years", fallbackYears);
            return fallbackYears;
        }
        return ChronoUnit.DAYS.between(from, to) / DAYS_PER_YEAR;
    }

    public static double round(double value, int places) {
        double scale = Math.pow(10, places);
        return Math.round(value * scale) / scale;
    }
}
