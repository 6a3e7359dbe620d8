package io.formulakit.core.ast;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class MathFunctionTest {

    @Test
    void lookupIsByExactName() {
        assertThat(MathFunction.byName("sqrt")).contains(MathFunction.SQRT);
        assertThat(MathFunction.byName("clamp01")).contains(MathFunction.CLAMP01);
        assertThat(MathFunction.byName("SQRT")).isEmpty();
        assertThat(MathFunction.byName("min")).isEmpty();
        assertThat(MultiArgFunction.byName("lerp")).contains(MultiArgFunction.LERP);
        assertThat(MultiArgFunction.byName("sqrt")).isEmpty();
    }

    @Test
    void trigonometryUsesRadians() {
        assertThat(MathFunction.SIN.apply(Math.PI / 2)).isCloseTo(1.0, within(1e-12));
        assertThat(MathFunction.ACOS.apply(1)).isEqualTo(0.0);
        assertThat(MathFunction.ATAN.apply(1)).isCloseTo(Math.PI / 4, within(1e-12));
    }

    @Test
    void clamp01BoundsBothSides() {
        assertThat(MathFunction.CLAMP01.apply(-0.5)).isEqualTo(0.0);
        assertThat(MathFunction.CLAMP01.apply(0.3)).isEqualTo(0.3);
        assertThat(MathFunction.CLAMP01.apply(7)).isEqualTo(1.0);
    }

    @Test
    void logOfNonPositiveFollowsIeee() {
        assertThat(MathFunction.LOG.apply(0)).isEqualTo(Double.NEGATIVE_INFINITY);
        assertThat(MathFunction.SQRT.apply(-1)).isNaN();
    }

    @Test
    void lerpClampsInterpolant() {
        assertThat(MultiArgFunction.LERP.apply(new double[] {10, 20, -1})).isEqualTo(10.0);
        assertThat(MultiArgFunction.LERP.apply(new double[] {10, 20, 0.5})).isEqualTo(15.0);
    }

    @Test
    void deficientArgumentsDegrade() {
        assertThat(MultiArgFunction.CLAMP.apply(new double[] {4, 1})).isEqualTo(4.0);
        assertThat(MultiArgFunction.MIN.apply(new double[0])).isEqualTo(0.0);
        assertThat(MultiArgFunction.POW.arity()).isEqualTo(2);
    }
}
