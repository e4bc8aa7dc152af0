package com.lynkvertx.batteryopt.solver;

import lombok.Getter;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Solver-independent description of a minimization LP: continuous variables
 * with bounds, named linear constraints and one linear objective.
 *
 * Instances are built once per optimization run and not modified after
 * they are handed to an {@link LpSolver}. Constraint and objective expressions
 * are stored as frozen copies.
 */
public class LinearModel {

    @Getter
    private final String name;

    private final List<Variable> variables = new ArrayList<>();
    private final List<Constraint> constraints = new ArrayList<>();

    @Getter
    private LinearExpression objective = new LinearExpression().freeze();

    public LinearModel(String name) {
        this.name = name;
    }

    /**
     * Add a continuous variable.
     *
     * @param name  Variable name, used in logs and diagnostics
     * @param lower Lower bound (may be {@link Double#NEGATIVE_INFINITY})
     * @param upper Upper bound (may be {@link Double#POSITIVE_INFINITY})
     * @return Index of the new variable
     */
    public int addVariable(String name, double lower, double upper) {
        if (lower > upper) {
            throw new IllegalArgumentException(String.format(
                "Variable %s has lower bound %.6f above upper bound %.6f", name, lower, upper));
        }
        int index = variables.size();
        variables.add(new Variable(index, name, lower, upper));
        return index;
    }

    public void addConstraint(String name, LinearExpression expression, Relation relation, double rhs) {
        for (Integer index : expression.getTerms().keySet()) {
            if (index < 0 || index >= variables.size()) {
                throw new IllegalArgumentException("Constraint " + name + " references unknown variable " + index);
            }
        }
        constraints.add(new Constraint(name, expression.freeze(), relation, rhs));
    }

    /**
     * Set the expression to minimize, replacing any previous objective.
     * The model keeps a frozen copy; later changes to {@code expression} do not reach it.
     *
     * @return The installed objective
     */
    public LinearExpression minimize(LinearExpression expression) {
        this.objective = expression.freeze();
        return objective;
    }

    public List<Variable> getVariables() {
        return Collections.unmodifiableList(variables);
    }

    public List<Constraint> getConstraints() {
        return Collections.unmodifiableList(constraints);
    }

    public int variableCount() {
        return variables.size();
    }

    public int constraintCount() {
        return constraints.size();
    }

    @Value
    public static class Variable {
        int index;
        String name;
        double lower;
        double upper;
    }

    @Value
    public static class Constraint {
        String name;
        LinearExpression expression;
        Relation relation;
        double rhs;
    }
}
