package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.exceptions.FormulaErrorException;
import com.spreadsheet.formula.value.ErrorKind;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Dates are serial numbers: whole days since 1899-12-30, time of day as the fraction.
 */
public final class DateSerials {

    public static final LocalDate EPOCH = LocalDate.of(1899, 12, 30);
    private static final double MAX_SERIAL = 2_958_465; // 9999-12-31
    private static final double SECONDS_PER_DAY = 24 * 60 * 60;

    private DateSerials() {
    }

    public static double toSerial(LocalDate date) {
        return ChronoUnit.DAYS.between(EPOCH, date);
    }

    public static double toSerial(LocalDateTime dateTime) {
        return toSerial(dateTime.toLocalDate()) + dateTime.toLocalTime().toSecondOfDay() / SECONDS_PER_DAY;
    }

    public static boolean isValidSerial(double serial) {
        return !Double.isNaN(serial) && serial >= 0 && serial <= MAX_SERIAL;
    }

    public static LocalDate toDate(double serial) {
        if (!isValidSerial(serial)) {
            throw new FormulaErrorException(ErrorKind.INVALID_NUMBER, "Not a date serial: " + serial);
        }
        return EPOCH.plusDays((long) Math.floor(serial));
    }

    /**
     * ISO "yyyy-MM-dd" text as a serial.
     */
    public static Optional<Double> parseIsoDate(String text) {
        try {
            return Optional.of(toSerial(LocalDate.parse(text.trim())));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
