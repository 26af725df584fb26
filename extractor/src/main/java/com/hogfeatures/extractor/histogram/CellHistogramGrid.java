package com.hogfeatures.extractor.histogram;

import java.util.Arrays;

/**
 * Orientation histograms for every cell, laid out as
 * [cellsY][cellsX][orientations] in a flat row-major array.
 */
public class CellHistogramGrid {
    private final int cellsY;
    private final int cellsX;
    private final int orientations;
    private final double[] bins;

    public CellHistogramGrid(int cellsY, int cellsX, int orientations, double[] bins) {
        if (bins == null || bins.length != cellsY * cellsX * orientations) {
            throw new IllegalArgumentException("bins must have length cellsY*cellsX*orientations");
        }
        this.cellsY = cellsY;
        this.cellsX = cellsX;
        this.orientations = orientations;
        this.bins = bins.clone();
    }

    public int getCellsY() {
        return cellsY;
    }

    public int getCellsX() {
        return cellsX;
    }

    public int getOrientations() {
        return orientations;
    }

    public boolean isEmpty() {
        return cellsY == 0 || cellsX == 0;
    }

    public double get(int cellY, int cellX, int bin) {
        return bins[offset(cellY, cellX) + bin];
    }

    public double[] histogram(int cellY, int cellX) {
        int head = offset(cellY, cellX);
        return Arrays.copyOfRange(bins, head, head + orientations);
    }

    /**
     * Copies one cell's histogram into {@code dest} starting at {@code destPos}.
     */
    public void copyHistogram(int cellY, int cellX, double[] dest, int destPos) {
        System.arraycopy(bins, offset(cellY, cellX), dest, destPos, orientations);
    }

    public double cellTotal(int cellY, int cellX) {
        int head = offset(cellY, cellX);
        double s = 0.0;
        for (int o = 0; o < orientations; o++) {
            s += bins[head + o];
        }
        return s;
    }

    /**
     * Returns a new grid with every bin multiplied by {@code factor}.
     */
    public CellHistogramGrid scaled(double factor) {
        double[] out = new double[bins.length];
        for (int i = 0; i < bins.length; i++) {
            out[i] = bins[i] * factor;
        }
        return new CellHistogramGrid(cellsY, cellsX, orientations, out);
    }

    public double[] toArray() {
        return bins.clone();
    }

    private int offset(int cellY, int cellX) {
        if (cellY < 0 || cellY >= cellsY || cellX < 0 || cellX >= cellsX) {
            throw new IndexOutOfBoundsException("cell (" + cellY + ", " + cellX + ") outside " + cellsY + "x" + cellsX);
        }
        return (cellY * cellsX + cellX) * orientations;
    }
}
