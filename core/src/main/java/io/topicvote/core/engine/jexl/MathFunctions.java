package io.topicvote.core.engine.jexl;

/** The {@code math:} namespace of raw expressions. Every function returns a Float. */
public final class MathFunctions {

    private MathFunctions() {
        // utility class
    }

    public static double ln(Object x) {
        return Math.log(number(x));
    }

    public static double log(Object x, Object base) {
        return Math.log(number(x)) / Math.log(number(base));
    }

    public static double log2(Object x) {
        return Math.log(number(x)) / Math.log(2);
    }

    public static double log10(Object x) {
        return Math.log10(number(x));
    }

    public static double exp(Object x) {
        return Math.exp(number(x));
    }

    public static double exp2(Object x) {
        return Math.pow(2, number(x));
    }

    public static double pow(Object x, Object exponent) {
        return Math.pow(number(x), number(exponent));
    }

    public static double sqrt(Object x) {
        return Math.sqrt(number(x));
    }

    public static double cbrt(Object x) {
        return Math.cbrt(number(x));
    }

    public static double abs(Object x) {
        return Math.abs(number(x));
    }

    public static double sin(Object x) {
        return Math.sin(number(x));
    }

    public static double cos(Object x) {
        return Math.cos(number(x));
    }

    public static double tan(Object x) {
        return Math.tan(number(x));
    }

    private static double number(Object x) {
        return ExpressionFunctions.number(x);
    }
}
