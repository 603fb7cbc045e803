package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.exceptions.FormulaErrorException;
import com.spreadsheet.formula.value.Coercions;
import com.spreadsheet.formula.value.ErrorKind;
import com.spreadsheet.formula.value.EvalResult;

import java.util.Locale;

/**
 * CONCAT, CONCATENATE, LEFT, RIGHT, MID, LEN, TRIM, UPPER, LOWER, PROPER, SUBSTITUTE.
 */
public final class TextFunctions {

    private TextFunctions() {
    }

    public static void registerAll(FunctionRegistry registry) {
        registry.register(FunctionDefinition.builder("CONCAT")
                .arity(Arity.atLeast(1))
                .implementation(args -> {
                    StringBuilder result = new StringBuilder();
                    for (EvalResult arg : args.all()) {
                        if (arg.isMatrix()) {
                            for (EvalResult cell : arg.getMatrix().flatten()) {
                                result.append(Coercions.toText(cell));
                            }
                        } else {
                            result.append(Coercions.toText(arg));
                        }
                    }
                    return EvalResult.text(result.toString());
                })
                .build());

        registry.register(FunctionDefinition.builder("CONCATENATE")
                .arity(Arity.atLeast(1))
                .params(ArgumentPolicy.TEXT)
                .implementation(args -> {
                    StringBuilder result = new StringBuilder();
                    for (int i = 0; i < args.size(); i++) {
                        result.append(args.text(i));
                    }
                    return EvalResult.text(result.toString());
                })
                .build());

        registry.register(FunctionDefinition.builder("LEFT")
                .arity(Arity.between(1, 2))
                .params(ArgumentPolicy.TEXT, ArgumentPolicy.NUMBER)
                .implementation(args -> {
                    String text = args.text(0);
                    int count = count(args.number(1, 1));
                    return EvalResult.text(text.substring(0, Math.min(count, text.length())));
                })
                .build());

        registry.register(FunctionDefinition.builder("RIGHT")
                .arity(Arity.between(1, 2))
                .params(ArgumentPolicy.TEXT, ArgumentPolicy.NUMBER)
                .implementation(args -> {
                    String text = args.text(0);
                    int count = count(args.number(1, 1));
                    return EvalResult.text(text.substring(Math.max(0, text.length() - count)));
                })
                .build());

        registry.register(FunctionDefinition.builder("MID")
                .arity(Arity.exactly(3))
                .params(ArgumentPolicy.TEXT, ArgumentPolicy.NUMBER, ArgumentPolicy.NUMBER)
                .implementation(args -> {
                    String text = args.text(0);
                    int start = (int) args.number(1);
                    if (start < 1) {
                        return EvalResult.error(ErrorKind.TYPE_MISMATCH);
                    }
                    int count = count(args.number(2));
                    if (start > text.length()) {
                        return EvalResult.EMPTY_TEXT;
                    }
                    int from = start - 1;
                    return EvalResult.text(text.substring(from, (int) Math.min((long) from + count, text.length())));
                })
                .build());

        registry.register(FunctionDefinition.builder("LEN")
                .arity(Arity.exactly(1))
                .params(ArgumentPolicy.TEXT)
                .implementation(args -> EvalResult.number(args.text(0).length()))
                .build());

        registry.register(FunctionDefinition.builder("TRIM")
                .arity(Arity.exactly(1))
                .params(ArgumentPolicy.TEXT)
                .implementation(args -> EvalResult.text(args.text(0).trim().replaceAll(" +", " ")))
                .build());

        registry.register(FunctionDefinition.builder("UPPER")
                .arity(Arity.exactly(1))
                .params(ArgumentPolicy.TEXT)
                .implementation(args -> EvalResult.text(args.text(0).toUpperCase(Locale.ROOT)))
                .build());

        registry.register(FunctionDefinition.builder("LOWER")
                .arity(Arity.exactly(1))
                .params(ArgumentPolicy.TEXT)
                .implementation(args -> EvalResult.text(args.text(0).toLowerCase(Locale.ROOT)))
                .build());

        registry.register(FunctionDefinition.builder("PROPER")
                .arity(Arity.exactly(1))
                .params(ArgumentPolicy.TEXT)
                .implementation(args -> EvalResult.text(proper(args.text(0))))
                .build());

        registry.register(FunctionDefinition.builder("SUBSTITUTE")
                .arity(Arity.between(3, 4))
                .params(ArgumentPolicy.TEXT, ArgumentPolicy.TEXT, ArgumentPolicy.TEXT, ArgumentPolicy.NUMBER)
                .implementation(args -> {
                    String text = args.text(0);
                    String oldText = args.text(1);
                    String newText = args.text(2);
                    if (!args.has(3)) {
                        return EvalResult.text(oldText.isEmpty() ? text : text.replace(oldText, newText));
                    }
                    int instance = (int) args.number(3);
                    if (instance < 1) {
                        return EvalResult.error(ErrorKind.TYPE_MISMATCH);
                    }
                    return EvalResult.text(substituteInstance(text, oldText, newText, instance));
                })
                .build());
    }

    private static int count(double requested) {
        if (requested < 0) {
            throw new FormulaErrorException(ErrorKind.TYPE_MISMATCH,
                    "Negative character count");
        }
        return requested > Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) requested;
    }

    /**
     * First letter of every run of letters upper-cased, the rest lower-cased.
     */
    static String proper(String text) {
        StringBuilder result = new StringBuilder(text.length());
        boolean inWord = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isLetter(c)) {
                result.append(inWord ? Character.toLowerCase(c) : Character.toUpperCase(c));
                inWord = true;
            } else {
                result.append(c);
                inWord = false;
            }
        }
        return result.toString();
    }

    private static String substituteInstance(String text, String oldText, String newText, int instance) {
        if (oldText.isEmpty()) {
            return text;
        }
        int from = 0;
        for (int seen = 1; ; seen++) {
            int at = text.indexOf(oldText, from);
            if (at < 0) {
                return text;
            }
            if (seen == instance) {
                return text.substring(0, at) + newText + text.substring(at + oldText.length());
            }
            from = at + oldText.length();
        }
    }
}
