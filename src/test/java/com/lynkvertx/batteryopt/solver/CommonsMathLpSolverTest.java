package com.lynkvertx.batteryopt.solver;

import com.lynkvertx.batteryopt.config.OptimizerConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class CommonsMathLpSolverTest {

    private OptimizerConfig config;
    private CommonsMathLpSolver solver;

    @BeforeEach
    void setUp() {
        config = new OptimizerConfig();
        solver = new CommonsMathLpSolver(config);
    }

    @Test
    void shouldFindOptimalVertex() {
        LinearModel model = new LinearModel("simple");
        int x = model.addVariable("x", 0.0, 10.0);
        int y = model.addVariable("y", 0.0, 10.0);
        model.addConstraint("cover", LinearExpression.of(x, 1.0).plus(y, 1.0), Relation.GEQ, 3.0);
        model.minimize(LinearExpression.of(x, 1.0).plus(y, 2.0));

        SolverResult result = solver.solve(model);

        assertThat(result.getStatus()).isEqualTo(SolverStatus.OPTIMAL);
        assertThat(result.value(x)).isCloseTo(3.0, within(1e-9));
        assertThat(result.value(y)).isCloseTo(0.0, within(1e-9));
        assertThat(result.getObjectiveValue()).isCloseTo(3.0, within(1e-9));
    }

    @Test
    void shouldApplyUpperBoundsAsConstraints() {
        LinearModel model = new LinearModel("upper");
        int x = model.addVariable("x", 0.0, 2.5);
        model.minimize(LinearExpression.of(x, -1.0));

        SolverResult result = solver.solve(model);

        assertThat(result.isOptimal()).isTrue();
        assertThat(result.value(x)).isCloseTo(2.5, within(1e-9));
    }

    @Test
    void shouldHonourFixedAndPositiveLowerBounds() {
        LinearModel model = new LinearModel("bounds");
        int fixed = model.addVariable("fixed", 4.0, 4.0);
        int floor = model.addVariable("floor", 1.5, Double.POSITIVE_INFINITY);
        model.minimize(LinearExpression.of(fixed, -1.0).plus(floor, 1.0));

        SolverResult result = solver.solve(model);

        assertThat(result.value(fixed)).isCloseTo(4.0, within(1e-9));
        assertThat(result.value(floor)).isCloseTo(1.5, within(1e-9));
    }

    @Test
    void shouldSupportNegativeLowerBounds() {
        LinearModel model = new LinearModel("free");
        int x = model.addVariable("x", -3.0, 5.0);
        model.minimize(LinearExpression.of(x, 1.0));

        SolverResult result = solver.solve(model);

        assertThat(result.value(x)).isCloseTo(-3.0, within(1e-9));
    }

    @Test
    void shouldReportInfeasibleModel() {
        LinearModel model = new LinearModel("infeasible");
        int x = model.addVariable("x", 0.0, 2.0);
        model.addConstraint("too_high", LinearExpression.of(x, 1.0), Relation.GEQ, 5.0);
        model.minimize(LinearExpression.of(x, 1.0));

        SolverResult result = solver.solve(model);

        assertThat(result.getStatus()).isEqualTo(SolverStatus.INFEASIBLE);
        assertThat(result.getValues()).isNull();
        assertThatThrownBy(() -> result.value(x)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldReportUnboundedModel() {
        LinearModel model = new LinearModel("unbounded");
        int x = model.addVariable("x", 0.0, Double.POSITIVE_INFINITY);
        model.addConstraint("floor", LinearExpression.of(x, 1.0), Relation.GEQ, 1.0);
        model.minimize(LinearExpression.of(x, -1.0));

        SolverResult result = solver.solve(model);

        assertThat(result.getStatus()).isEqualTo(SolverStatus.UNBOUNDED);
    }

    @Test
    void shouldReportSolverErrorWhenIterationLimitIsHit() {
        config.setMaxIterations(1);
        LinearModel model = new LinearModel("iterations");
        int x = model.addVariable("x", 0.0, Double.POSITIVE_INFINITY);
        int y = model.addVariable("y", 0.0, Double.POSITIVE_INFINITY);
        int z = model.addVariable("z", 0.0, Double.POSITIVE_INFINITY);
        model.addConstraint("sum", LinearExpression.of(x, 1.0).plus(y, 1.0).plus(z, 1.0), Relation.EQ, 6.0);
        model.addConstraint("diff", LinearExpression.of(x, 1.0).minus(y, 1.0), Relation.EQ, 1.0);
        model.addConstraint("mix", LinearExpression.of(y, 1.0).minus(z, 2.0), Relation.EQ, -1.0);
        model.minimize(LinearExpression.of(x, 1.0).plus(y, 1.0).plus(z, 1.0));

        SolverResult result = solver.solve(model);

        assertThat(result.getStatus()).isEqualTo(SolverStatus.SOLVER_ERROR);
        assertThat(result.getMessage()).contains("did not converge");
    }

    @Test
    void shouldRejectInvertedBounds() {
        LinearModel model = new LinearModel("inverted");

        assertThatThrownBy(() -> model.addVariable("x", 2.0, 1.0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("x");
    }

    @Test
    void shouldRejectConstraintOnUnknownVariable() {
        LinearModel model = new LinearModel("unknown");
        model.addVariable("x", 0.0, 1.0);

        assertThatThrownBy(() -> model.addConstraint("bad", LinearExpression.of(3, 1.0), Relation.EQ, 0.0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("bad");
    }

    @Test
    void shouldAccumulateRepeatedTerms() {
        LinearExpression expression = LinearExpression.of(0, 1.5).plus(0, 2.0).minus(1, 1.0);

        assertThat(expression.getTerms()).containsEntry(0, 3.5).containsEntry(1, -1.0);
        assertThat(expression.evaluate(new double[]{2.0, 4.0})).isCloseTo(3.0, within(1e-12));
    }

    @Test
    void shouldHandOutCopiesOfSolutionValues() {
        LinearModel model = new LinearModel("copy");
        int x = model.addVariable("x", 0.0, 10.0);
        model.addConstraint("floor", LinearExpression.of(x, 1.0), Relation.GEQ, 2.0);
        model.minimize(LinearExpression.of(x, 1.0));
        SolverResult result = solver.solve(model);

        result.getValues()[x] = 99.0;

        assertThat(result.value(x)).isCloseTo(2.0, within(1e-9));
        assertThat(result.getValues()[x]).isCloseTo(2.0, within(1e-9));
    }

    @Test
    void shouldKeepModelIndependentOfLaterExpressionChanges() {
        LinearModel model = new LinearModel("frozen");
        int x = model.addVariable("x", 0.0, 10.0);
        int y = model.addVariable("y", 0.0, 10.0);
        LinearExpression cover = LinearExpression.of(x, 1.0);
        LinearExpression cost = LinearExpression.of(x, 1.0);
        model.addConstraint("cover", cover, Relation.GEQ, 3.0);
        LinearExpression installed = model.minimize(cost);

        cover.plus(y, 1.0);
        cost.plus(y, -5.0);

        assertThat(model.getConstraints().get(0).getExpression().getTerms()).containsOnlyKeys(x);
        assertThat(model.getObjective().getTerms()).containsOnlyKeys(x);
        assertThat(installed.isFrozen()).isTrue();
        assertThatThrownBy(() -> model.getObjective().plus(y, 1.0))
            .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> model.getConstraints().get(0).getExpression().plus(y, 1.0))
            .isInstanceOf(UnsupportedOperationException.class);

        SolverResult result = solver.solve(model);
        assertThat(result.getObjectiveValue()).isCloseTo(3.0, within(1e-9));
    }
}
