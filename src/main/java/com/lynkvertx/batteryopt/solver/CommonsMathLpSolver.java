package com.lynkvertx.batteryopt.solver;

import com.lynkvertx.batteryopt.config.OptimizerConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.exception.MathArithmeticException;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.exception.TooManyIterationsException;
import org.apache.commons.math3.optim.MaxIter;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.linear.LinearConstraint;
import org.apache.commons.math3.optim.linear.LinearConstraintSet;
import org.apache.commons.math3.optim.linear.LinearObjectiveFunction;
import org.apache.commons.math3.optim.linear.NoFeasibleSolutionException;
import org.apache.commons.math3.optim.linear.NonNegativeConstraint;
import org.apache.commons.math3.optim.linear.PivotSelectionRule;
import org.apache.commons.math3.optim.linear.Relationship;
import org.apache.commons.math3.optim.linear.SimplexSolver;
import org.apache.commons.math3.optim.linear.UnboundedSolutionException;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * {@link LpSolver} backed by the Apache Commons Math simplex solver.
 *
 * Variable bounds are not native to the simplex tableau, so they are turned into
 * extra constraint rows: finite upper bounds become {@code x <= u}, positive lower
 * bounds {@code x >= l}, fixed variables {@code x == v}. Non-negativity is passed
 * as solver data whenever every variable has a lower bound of at least zero.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CommonsMathLpSolver implements LpSolver {

    private final OptimizerConfig config;

    @Override
    public SolverResult solve(LinearModel model) {
        int n = model.variableCount();
        if (n == 0) {
            return SolverResult.optimal(new double[0], 0.0);
        }

        boolean nonNegative = model.getVariables().stream().allMatch(v -> v.getLower() >= 0.0);

        List<LinearConstraint> rows = new ArrayList<>();
        for (LinearModel.Constraint constraint : model.getConstraints()) {
            rows.add(new LinearConstraint(
                dense(constraint.getExpression(), n),
                relationship(constraint.getRelation()),
                constraint.getRhs()));
        }
        int constraintRows = rows.size();
        addBoundRows(model, nonNegative, rows);

        LinearObjectiveFunction objective = new LinearObjectiveFunction(dense(model.getObjective(), n), 0.0);
        SimplexSolver solver = new SimplexSolver(config.getEpsilon(), config.getMaxUlps(), config.getCutOff());
        PivotSelectionRule pivotRule = config.getPivotRule() == OptimizerConfig.PivotRule.DANTZIG
            ? PivotSelectionRule.DANTZIG
            : PivotSelectionRule.BLAND;

        log.debug("Solving LP '{}': {} variables, {} constraints, {} bound rows",
            model.getName(), n, constraintRows, rows.size() - constraintRows);

        try {
            PointValuePair solution = solver.optimize(
                new MaxIter(config.getMaxIterations()),
                objective,
                new LinearConstraintSet(rows),
                GoalType.MINIMIZE,
                new NonNegativeConstraint(nonNegative),
                pivotRule);
            log.debug("LP '{}' optimal after {} iterations, objective = {}",
                model.getName(), solver.getIterations(), solution.getValue());
            return SolverResult.optimal(solution.getPoint(), solution.getValue());
        } catch (NoFeasibleSolutionException e) {
            log.debug("LP '{}' infeasible", model.getName());
            return SolverResult.failed(SolverStatus.INFEASIBLE, "No schedule satisfies all constraints", e);
        } catch (UnboundedSolutionException e) {
            return SolverResult.failed(SolverStatus.UNBOUNDED, "Objective is unbounded", e);
        } catch (TooManyIterationsException e) {
            return SolverResult.failed(SolverStatus.SOLVER_ERROR,
                "Simplex did not converge within " + config.getMaxIterations() + " iterations", e);
        } catch (MathIllegalStateException | MathArithmeticException | MathIllegalArgumentException e) {
            return SolverResult.failed(SolverStatus.SOLVER_ERROR, "Simplex failure: " + e.getMessage(), e);
        }
    }

    private void addBoundRows(LinearModel model, boolean nonNegative, List<LinearConstraint> rows) {
        int n = model.variableCount();
        for (LinearModel.Variable variable : model.getVariables()) {
            double lower = variable.getLower();
            double upper = variable.getUpper();
            if (lower == upper) {
                rows.add(new LinearConstraint(unit(variable.getIndex(), n), Relationship.EQ, lower));
                continue;
            }
            boolean lowerImplied = nonNegative && lower == 0.0;
            if (!lowerImplied && !Double.isInfinite(lower)) {
                rows.add(new LinearConstraint(unit(variable.getIndex(), n), Relationship.GEQ, lower));
            }
            if (!Double.isInfinite(upper)) {
                rows.add(new LinearConstraint(unit(variable.getIndex(), n), Relationship.LEQ, upper));
            }
        }
    }

    private static double[] dense(LinearExpression expression, int n) {
        double[] coefficients = new double[n];
        for (Map.Entry<Integer, Double> term : expression.getTerms().entrySet()) {
            coefficients[term.getKey()] += term.getValue();
        }
        return coefficients;
    }

    private static double[] unit(int index, int n) {
        double[] coefficients = new double[n];
        coefficients[index] = 1.0;
        return coefficients;
    }

    private static Relationship relationship(Relation relation) {
        switch (relation) {
            case EQ:
                return Relationship.EQ;
            case LEQ:
                return Relationship.LEQ;
            case GEQ:
                return Relationship.GEQ;
            default:
                throw new IllegalArgumentException("Unknown relation: " + relation);
        }
    }
}
