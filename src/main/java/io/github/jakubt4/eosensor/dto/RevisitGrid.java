package io.github.jakubt4.eosensor.dto;

/**
 * Revisit counts over a latitude/longitude grid. Row 0 is the northernmost band,
 * column 0 starts at -180 degrees longitude.
 */
public final class RevisitGrid {

    private final int[][] cells;
    private final int maxCount;

    public RevisitGrid(final int[][] cells) {
        this.cells = new int[cells.length][];
        var max = 0;
        for (var row = 0; row < cells.length; row++) {
            this.cells[row] = cells[row].clone();
            for (final var count : this.cells[row]) {
                max = Math.max(max, count);
            }
        }
        this.maxCount = max;
    }

    public int rows() {
        return cells.length;
    }

    public int columns() {
        return cells.length == 0 ? 0 : cells[0].length;
    }

    public int count(final int row, final int column) {
        return cells[row][column];
    }

    /**
     * Largest cell count in the grid.
     */
    public int maxCount() {
        return maxCount;
    }

    public long totalCount() {
        var total = 0L;
        for (final var row : cells) {
            for (final var count : row) {
                total += count;
            }
        }
        return total;
    }

    public int[][] toArray() {
        final var copy = new int[cells.length][];
        for (var row = 0; row < cells.length; row++) {
            copy[row] = cells[row].clone();
        }
        return copy;
    }
}
