package com.hellblazer.kinetica.geometry;

import javax.vecmath.Tuple2f;
import javax.vecmath.Vector2f;

/**
 * Deterministic math for replayable simulation.
 * <p>
 * Identical inputs must produce identical fragment scatter, steering and wrap results on every run, so all
 * trigonometry goes through StrictMath (IEEE 754 compliance) instead of Math, and vector accumulation uses a binary
 * reduction tree so the result does not depend on accumulation order.
 * <p>
 * Usage:
 * <pre>
 * float heading = DeterministicMath.atan2(dy, dx);
 * var forward = DeterministicMath.unit(heading);
 * float h = DeterministicMath.wrapAngle(heading + turn);
 *
 * Vector2f[] repulsions = collectRepulsions();
 * Vector2f avoid = DeterministicMath.stableSumVectors(repulsions);
 * </pre>
 *
 * @author hal.hildebrand
 */
public class DeterministicMath {

    /**
     * One full turn in radians.
     */
    public static final float TWO_PI = (float) (2.0 * StrictMath.PI);

    // Prevent instantiation
    private DeterministicMath() {
    }

    /**
     * Deterministic square root.
     *
     * @param x Input value
     * @return Square root of x
     */
    public static float sqrt(float x) {
        return (float) StrictMath.sqrt(x);
    }

    /**
     * Deterministic sine.
     *
     * @param x Angle in radians
     * @return Sine of x
     */
    public static float sin(float x) {
        return (float) StrictMath.sin(x);
    }

    /**
     * Deterministic cosine.
     *
     * @param x Angle in radians
     * @return Cosine of x
     */
    public static float cos(float x) {
        return (float) StrictMath.cos(x);
    }

    /**
     * Deterministic arctangent of y/x.
     *
     * @param y Y coordinate
     * @param x X coordinate
     * @return Angle in radians
     */
    public static float atan2(float y, float x) {
        return (float) StrictMath.atan2(y, x);
    }

    /**
     * Deterministic power function.
     *
     * @param base     Base value
     * @param exponent Exponent
     * @return base^exponent
     */
    public static float pow(float base, float exponent) {
        return (float) StrictMath.pow(base, exponent);
    }

    /**
     * Wrap a value into {@code [0, extent)}.
     * <p>
     * Float rounding can turn a tiny negative remainder plus {@code extent} into exactly {@code extent}; that case
     * folds to zero so the half-open interval always holds.
     *
     * @param value  Value to wrap
     * @param extent Positive period
     * @return Wrapped value in [0, extent)
     */
    public static float wrap(float value, float extent) {
        float r = value % extent;
        if (r < 0.0f) {
            r += extent;
        }
        if (r >= extent || r < 0.0f) {
            return 0.0f;
        }
        return r;
    }

    /**
     * Wrap an angle into {@code [0, 2π)}.
     *
     * @param angle Angle in radians
     * @return Equivalent angle in [0, 2π)
     */
    public static float wrapAngle(float angle) {
        return wrap(angle, TWO_PI);
    }

    /**
     * Signed shortest angular difference {@code to - from}, in {@code [-π, π)}.
     *
     * @param from Source angle in radians
     * @param to   Target angle in radians
     * @return Signed delta to turn from {@code from} to {@code to}
     */
    public static float angleDelta(float from, float to) {
        float pi = (float) StrictMath.PI;
        return wrap(to - from + pi, TWO_PI) - pi;
    }

    /**
     * Unit vector pointing along {@code angle}.
     *
     * @param angle Angle in radians
     * @return (cos angle, sin angle)
     */
    public static Vector2f unit(float angle) {
        return new Vector2f(cos(angle), sin(angle));
    }

    /**
     * Length of a 2D tuple using deterministic sqrt.
     */
    public static float length(Tuple2f t) {
        return sqrt(t.x * t.x + t.y * t.y);
    }

    /**
     * Euclidean distance between two points using deterministic sqrt.
     */
    public static float distance(Tuple2f a, Tuple2f b) {
        float dx = a.x - b.x;
        float dy = a.y - b.y;
        return sqrt(dx * dx + dy * dy);
    }

    /**
     * Stable summation using binary reduction tree.
     * <p>
     * Prevents floating-point rounding errors from order-dependent accumulation.
     * <p>
     * Complexity: O(n log n) time, O(log n) space (recursion stack)
     *
     * @param values Array of values to sum
     * @return Sum of all values
     */
    public static float stableSum(float[] values) {
        if (values.length == 0) {
            return 0.0f;
        }
        return stableSumRecursive(values, 0, values.length);
    }

    private static float stableSumRecursive(float[] values, int start, int end) {
        int length = end - start;

        if (length == 0) {
            return 0.0f;
        } else if (length == 1) {
            return values[start];
        } else {
            int mid = start + length / 2;
            float leftSum = stableSumRecursive(values, start, mid);
            float rightSum = stableSumRecursive(values, mid, end);
            return leftSum + rightSum;
        }
    }

    /**
     * Stable vector summation, binary reduction applied independently to each component.
     *
     * @param vectors Array of vectors to sum
     * @return Sum of all vectors
     */
    public static Vector2f stableSumVectors(Vector2f[] vectors) {
        if (vectors.length == 0) {
            return new Vector2f(0.0f, 0.0f);
        }

        float[] xComponents = new float[vectors.length];
        float[] yComponents = new float[vectors.length];

        for (int i = 0; i < vectors.length; i++) {
            xComponents[i] = vectors[i].x;
            yComponents[i] = vectors[i].y;
        }

        return new Vector2f(stableSum(xComponents), stableSum(yComponents));
    }
}
