package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.exceptions.FormulaErrorException;
import com.spreadsheet.formula.value.ErrorKind;
import com.spreadsheet.formula.value.EvalResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A named function: arity, per-parameter coercion, volatility and its implementation.
 *
 * Parameter policies are positional; the last one repeats for any further arguments,
 * and a definition without policies takes every argument as evaluated.
 * Unless the definition is lazy, every argument is evaluated before the body runs and
 * the first error among them is the result. A body that fails any other way, or returns
 * null, gives #VALUE!.
 */
public final class FunctionDefinition {

    private static final Logger LOG = LoggerFactory.getLogger(FunctionDefinition.class);

    private static final Pattern VALID_NAME = Pattern.compile("^[A-Za-z][A-Za-z0-9_.]*$");

    private final String name;
    private final Arity arity;
    private final List<ArgumentPolicy> policies;
    private final boolean volatileResult;
    private final boolean lazy;
    private final FormulaFunction implementation;

    private FunctionDefinition(Builder builder) {
        this.name = canonicalName(builder.name);
        this.arity = Objects.requireNonNull(builder.arity, "arity of " + builder.name);
        this.policies = Collections.unmodifiableList(new ArrayList<>(builder.policies));
        this.volatileResult = builder.volatileResult;
        this.lazy = builder.lazy;
        this.implementation = Objects.requireNonNull(builder.implementation, "implementation of " + builder.name);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Upper-cased function name; rejects names a formula could never call.
     */
    public static String canonicalName(String name) {
        if (name == null || !VALID_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid function name: " + name);
        }
        return name.toUpperCase(Locale.ROOT);
    }

    public EvalResult invoke(FunctionArguments args) {
        try {
            if (!lazy) {
                for (int i = 0; i < args.size(); i++) {
                    args.get(i);
                }
            }
            EvalResult result = implementation.apply(args);
            if (result == null) {
                LOG.warn("Function {} returned null", name);
                return EvalResult.error(ErrorKind.TYPE_MISMATCH);
            }
            return result;
        } catch (FormulaErrorException e) {
            return EvalResult.error(e.getErrorKind());
        } catch (RuntimeException e) {
            LOG.warn("Function {} failed", name, e);
            return EvalResult.error(ErrorKind.TYPE_MISMATCH);
        }
    }

    public ArgumentPolicy policyFor(int index) {
        if (policies.isEmpty()) {
            return ArgumentPolicy.ANY;
        }
        return policies.get(Math.min(index, policies.size() - 1));
    }

    public String getName() {
        return name;
    }
    public Arity getArity() {
        return arity;
    }
    public boolean isVolatile() {
        return volatileResult;
    }

    public static final class Builder {
        private final String name;
        private Arity arity;
        private final List<ArgumentPolicy> policies = new ArrayList<>();
        private boolean volatileResult;
        private boolean lazy;
        private FormulaFunction implementation;

        private Builder(String name) {
            this.name = name;
        }

        public Builder arity(Arity arity) {
            this.arity = arity;
            return this;
        }

        public Builder params(ArgumentPolicy... policies) {
            this.policies.clear();
            this.policies.addAll(Arrays.asList(policies));
            return this;
        }

        public Builder volatileResult(boolean volatileResult) {
            this.volatileResult = volatileResult;
            return this;
        }

        public Builder lazy() {
            this.lazy = true;
            return this;
        }

        public Builder implementation(FormulaFunction implementation) {
            this.implementation = implementation;
            return this;
        }

        public FunctionDefinition build() {
            return new FunctionDefinition(this);
        }
    }
}
