package com.lynkvertx.batteryopt.solver;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sparse linear expression over model variables: sum of coefficient * variable.
 * Repeated terms on the same variable are accumulated.
 *
 * Expressions are built up with {@link #plus} and {@link #minus}; a
 * {@link #freeze() frozen} copy rejects further terms.
 */
public final class LinearExpression {

    private final Map<Integer, Double> terms = new LinkedHashMap<>();

    private final boolean frozen;

    public LinearExpression() {
        this.frozen = false;
    }

    private LinearExpression(Map<Integer, Double> terms) {
        this.terms.putAll(terms);
        this.frozen = true;
    }

    public static LinearExpression of(int variable, double coefficient) {
        return new LinearExpression().plus(variable, coefficient);
    }

    public LinearExpression plus(int variable, double coefficient) {
        if (frozen) {
            throw new UnsupportedOperationException("Expression is frozen once added to a model");
        }
        terms.merge(variable, coefficient, Double::sum);
        return this;
    }

    public LinearExpression minus(int variable, double coefficient) {
        return plus(variable, -coefficient);
    }

    /** Unmodifiable snapshot of the current terms; returns this if already frozen */
    public LinearExpression freeze() {
        return frozen ? this : new LinearExpression(terms);
    }

    public boolean isFrozen() {
        return frozen;
    }

    /** Variable index to coefficient, in insertion order */
    public Map<Integer, Double> getTerms() {
        return Collections.unmodifiableMap(terms);
    }

    public boolean isEmpty() {
        return terms.isEmpty();
    }

    /** Evaluate the expression for a full vector of variable values */
    public double evaluate(double[] values) {
        double sum = 0.0;
        for (Map.Entry<Integer, Double> term : terms.entrySet()) {
            sum += term.getValue() * values[term.getKey()];
        }
        return sum;
    }
}
