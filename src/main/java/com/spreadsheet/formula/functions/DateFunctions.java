package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.exceptions.FormulaErrorException;
import com.spreadsheet.formula.value.ErrorKind;
import com.spreadsheet.formula.value.EvalResult;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Locale;

/**
 * TODAY, NOW, DATE, YEAR, MONTH, DAY, DATEDIF.
 * TODAY and NOW read the clock the workbook was configured with and are volatile.
 */
public final class DateFunctions {

    // Anything further out lands past 9999-12-31 from any starting year
    private static final double MAX_MONTH_OFFSET = 12 * 10_000;
    private static final double MAX_DAY_OFFSET = 366 * 10_000;

    private DateFunctions() {
    }

    public static void registerAll(FunctionRegistry registry) {
        registry.register(FunctionDefinition.builder("TODAY")
                .arity(Arity.exactly(0))
                .volatileResult(true)
                .implementation(args -> EvalResult.number(DateSerials.toSerial(LocalDate.now(args.getClock()))))
                .build());

        registry.register(FunctionDefinition.builder("NOW")
                .arity(Arity.exactly(0))
                .volatileResult(true)
                .implementation(args -> EvalResult.number(DateSerials.toSerial(LocalDateTime.now(args.getClock()))))
                .build());

        registry.register(FunctionDefinition.builder("DATE")
                .arity(Arity.exactly(3))
                .params(ArgumentPolicy.NUMBER)
                .implementation(args -> {
                    int year = (int) args.number(0);
                    if (year < 0 || year > 9999) {
                        return EvalResult.error(ErrorKind.INVALID_NUMBER);
                    }
                    if (year < 1900) {
                        year += 1900;
                    }
                    double month = args.number(1);
                    double day = args.number(2);
                    if (Math.abs(month) > MAX_MONTH_OFFSET || Math.abs(day) > MAX_DAY_OFFSET) {
                        return EvalResult.error(ErrorKind.INVALID_NUMBER);
                    }
                    // Months and days outside their ranges roll over into neighbouring months and years
                    LocalDate date;
                    try {
                        date = LocalDate.of(year, 1, 1)
                                .plusMonths((long) month - 1)
                                .plusDays((long) day - 1);
                    } catch (DateTimeException e) {
                        return EvalResult.error(ErrorKind.INVALID_NUMBER);
                    }
                    double serial = DateSerials.toSerial(date);
                    if (!DateSerials.isValidSerial(serial)) {
                        return EvalResult.error(ErrorKind.INVALID_NUMBER);
                    }
                    return EvalResult.number(serial);
                })
                .build());

        registry.register(FunctionDefinition.builder("YEAR")
                .arity(Arity.exactly(1))
                .params(ArgumentPolicy.DATE)
                .implementation(args -> EvalResult.number(date(args, 0).getYear()))
                .build());

        registry.register(FunctionDefinition.builder("MONTH")
                .arity(Arity.exactly(1))
                .params(ArgumentPolicy.DATE)
                .implementation(args -> EvalResult.number(date(args, 0).getMonthValue()))
                .build());

        registry.register(FunctionDefinition.builder("DAY")
                .arity(Arity.exactly(1))
                .params(ArgumentPolicy.DATE)
                .implementation(args -> EvalResult.number(date(args, 0).getDayOfMonth()))
                .build());

        registry.register(FunctionDefinition.builder("DATEDIF")
                .arity(Arity.exactly(3))
                .params(ArgumentPolicy.DATE, ArgumentPolicy.DATE, ArgumentPolicy.TEXT)
                .implementation(args -> {
                    LocalDate start = date(args, 0);
                    LocalDate end = date(args, 1);
                    if (start.isAfter(end)) {
                        return EvalResult.error(ErrorKind.INVALID_NUMBER);
                    }
                    switch (args.text(2).trim().toUpperCase(Locale.ROOT)) {
                        case "D":
                            return EvalResult.number(ChronoUnit.DAYS.between(start, end));
                        case "M":
                            return EvalResult.number(ChronoUnit.MONTHS.between(start, end));
                        case "Y":
                            return EvalResult.number(ChronoUnit.YEARS.between(start, end));
                        default:
                            throw new FormulaErrorException(ErrorKind.TYPE_MISMATCH, "Unknown DATEDIF unit");
                    }
                })
                .build());
    }

    private static LocalDate date(FunctionArguments args, int index) {
        return DateSerials.toDate(args.get(index).getNumber());
    }
}
