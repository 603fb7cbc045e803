package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.exceptions.FormulaErrorException;
import com.spreadsheet.formula.value.Coercions;
import com.spreadsheet.formula.value.EvalResult;
import com.spreadsheet.formula.value.RangeMatrix;

import java.util.Optional;

/**
 * What a function parameter accepts, and how an evaluated argument is brought into that shape.
 * An error argument is re-raised unchanged by every policy.
 */
public enum ArgumentPolicy {

    /** The value as evaluated; ranges stay matrices. */
    ANY {
        @Override
        EvalResult convert(EvalResult value) {
            return value;
        }
    },

    NUMBER {
        @Override
        EvalResult convert(EvalResult value) {
            return EvalResult.number(Coercions.toNumber(value));
        }
    },

    TEXT {
        @Override
        EvalResult convert(EvalResult value) {
            return EvalResult.text(Coercions.toText(value));
        }
    },

    LOGICAL {
        @Override
        EvalResult convert(EvalResult value) {
            return EvalResult.bool(Coercions.isTruthy(value));
        }
    },

    /** A date serial; ISO "yyyy-MM-dd" text is accepted too. */
    DATE {
        @Override
        EvalResult convert(EvalResult value) {
            EvalResult scalar = Coercions.toScalar(value);
            if (scalar.isText()) {
                Optional<Double> serial = DateSerials.parseIsoDate(scalar.getText());
                if (serial.isPresent()) {
                    return EvalResult.number(serial.get());
                }
            }
            return EvalResult.number(Coercions.toNumber(scalar));
        }
    },

    /** A matrix; a single value becomes a 1x1 matrix. */
    RANGE {
        @Override
        EvalResult convert(EvalResult value) {
            if (value.isMatrix()) {
                return value;
            }
            return EvalResult.matrix(RangeMatrix.single(value));
        }
    };

    public EvalResult coerce(EvalResult value) {
        if (value.isError()) {
            throw new FormulaErrorException(value.getError());
        }
        return convert(value);
    }

    abstract EvalResult convert(EvalResult value);
}
