package com.herzen.rec.matrix;

public final class Vectors {

    private Vectors() {}

    public static double dot(double[] a, double[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }

    public static double norm(double[] a) {
        return Math.sqrt(dot(a, a));
    }

    /**
     * Cosine similarity; a zero-norm operand yields 0 rather than NaN.
     */
    public static double cosine(double[] a, double[] b) {
        double na = norm(a);
        double nb = norm(b);
        if (na == 0 || nb == 0) return 0.0;
        double similarity = dot(a, b) / (na * nb);
        return Double.isFinite(similarity) ? similarity : 0.0;
    }

    public static void normalizeInPlace(double[] a) {
        double n = norm(a);
        if (n == 0) return;
        for (int i = 0; i < a.length; i++) {
            a[i] /= n;
        }
    }
}
