package com.rankfusion.vector.service;

public final class VectorMath {

    private VectorMath() {
    }

    public static double dot(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("dimension mismatch: " + a.length + " vs " + b.length);
        }
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            sum += (double) a[i] * b[i];
        }
        return sum;
    }

    public static double l2Norm(float[] v) {
        double sum = 0.0;
        for (float x : v) {
            sum += (double) x * x;
        }
        return Math.sqrt(sum);
    }

    // Zero vectors have no direction; their similarity to anything is 0.
    public static double cosine(float[] a, float[] b) {
        double na = l2Norm(a);
        double nb = l2Norm(b);
        if (na == 0.0 || nb == 0.0) {
            return 0.0;
        }
        return dot(a, b) / (na * nb);
    }

    public static double cosineDistance(float[] a, float[] b) {
        return 1.0 - cosine(a, b);
    }
}
