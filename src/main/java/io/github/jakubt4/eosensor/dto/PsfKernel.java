package io.github.jakubt4.eosensor.dto;

/**
 * Square, non-negative convolution kernel. Synthesized kernels are normalized to unit sum.
 */
public final class PsfKernel {

    private final double[][] taps;

    public PsfKernel(final double[][] taps) {
        if (taps.length == 0) {
            throw new IllegalArgumentException("Kernel must have at least one tap");
        }
        this.taps = new double[taps.length][];
        for (var row = 0; row < taps.length; row++) {
            if (taps[row].length != taps.length) {
                throw new IllegalArgumentException("Kernel must be square, row " + row
                        + " has " + taps[row].length + " taps, expected " + taps.length);
            }
            this.taps[row] = taps[row].clone();
        }
    }

    /**
     * Kernel with a single unit tap at its center; convolving with it is a no-op.
     */
    public static PsfKernel identity(final int size) {
        final var taps = new double[size][size];
        taps[size / 2][size / 2] = 1.0;
        return new PsfKernel(taps);
    }

    public int size() {
        return taps.length;
    }

    public double tap(final int row, final int column) {
        return taps[row][column];
    }

    public double sum() {
        var sum = 0.0;
        for (final var row : taps) {
            for (final var value : row) {
                sum += value;
            }
        }
        return sum;
    }

    /**
     * Sum of squared taps.
     */
    public double power() {
        var power = 0.0;
        for (final var row : taps) {
            for (final var value : row) {
                power += value * value;
            }
        }
        return power;
    }

    /**
     * Kernel rotated by 180 degrees, used for correlation.
     */
    public PsfKernel flipped() {
        final var n = taps.length;
        final var result = new double[n][n];
        for (var row = 0; row < n; row++) {
            for (var column = 0; column < n; column++) {
                result[row][column] = taps[n - 1 - row][n - 1 - column];
            }
        }
        return new PsfKernel(result);
    }

    public double[][] toArray() {
        final var copy = new double[taps.length][];
        for (var row = 0; row < taps.length; row++) {
            copy[row] = taps[row].clone();
        }
        return copy;
    }
}
