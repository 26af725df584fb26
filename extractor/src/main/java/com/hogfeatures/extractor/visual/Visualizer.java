package com.hogfeatures.extractor.visual;

import com.hogfeatures.extractor.GrayImage;
import com.hogfeatures.extractor.InvalidArgumentException;
import com.hogfeatures.extractor.gradient.GradientField;
import com.hogfeatures.extractor.histogram.CellHistogramGrid;
import com.hogfeatures.util.MathUtil;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders cell histograms as a "star" of line segments per cell, one segment
 * per orientation bin, drawn through the cell center along the bin's center
 * angle. Each segment's intensity is its bin weight relative to the cell's
 * strongest bin. Segments add up where they overlap and the canvas is clipped
 * to {@code maxIntensity}.
 */
public class Visualizer {

    public static final double DEFAULT_MAX_INTENSITY = 1.0;

    private final double maxIntensity;

    public Visualizer() {
        this(DEFAULT_MAX_INTENSITY);
    }

    public Visualizer(double maxIntensity) {
        if (!(maxIntensity > 0)) {
            throw new InvalidArgumentException("maxIntensity must be positive, got " + maxIntensity);
        }
        this.maxIntensity = maxIntensity;
    }

    public GrayImage render(CellHistogramGrid cells, int width, int height, int pixelsPerCellX, int pixelsPerCellY,
            boolean signed) {
        InvalidArgumentException.requirePositive("width", width);
        InvalidArgumentException.requirePositive("height", height);
        InvalidArgumentException.requirePositive("pixelsPerCell.x", pixelsPerCellX);
        InvalidArgumentException.requirePositive("pixelsPerCell.y", pixelsPerCellY);

        int orientations = cells.getOrientations();
        int radius = Math.max(0, Math.min(pixelsPerCellX, pixelsPerCellY) / 2 - 1);
        int[][][] lines = orientedLines(orientations, radius, GradientField.orientationRange(signed));

        double[] canvas = new double[width * height];
        for (int cy = 0; cy < cells.getCellsY(); cy++) {
            for (int cx = 0; cx < cells.getCellsX(); cx++) {
                double[] hist = cells.histogram(cy, cx);
                double peak = MathUtil.max(hist);
                if (peak <= 0) {
                    continue;
                }
                int centerRow = cy * pixelsPerCellY + pixelsPerCellY / 2;
                int centerCol = cx * pixelsPerCellX + pixelsPerCellX / 2;
                for (int o = 0; o < orientations; o++) {
                    double weight = hist[o] / peak;
                    if (weight <= 0) {
                        continue;
                    }
                    for (int[] offset : lines[o]) {
                        int r = centerRow + offset[0];
                        int c = centerCol + offset[1];
                        if (r >= 0 && r < height && c >= 0 && c < width) {
                            canvas[r * width + c] += weight;
                        }
                    }
                }
            }
        }

        MathUtil.clipInPlace(canvas, maxIntensity);
        return GrayImage.of(width, height, canvas);
    }

    /**
     * Pixel offsets {row, col} for a segment through the origin along each bin
     * center angle. Offsets are unique within a segment so each pixel receives
     * a bin's weight once.
     */
    static int[][][] orientedLines(int orientations, int radius, double range) {
        int[][][] result = new int[orientations][][];
        double binWidth = range / orientations;
        for (int o = 0; o < orientations; o++) {
            double angle = Math.toRadians((o + 0.5) * binWidth);
            double dRow = Math.sin(angle);
            double dCol = Math.cos(angle);

            List<int[]> line = new ArrayList<>();
            line.add(new int[] { 0, 0 });
            for (int step = 1; step <= radius; step++) {
                int r = (int) Math.round(dRow * step);
                int c = (int) Math.round(dCol * step);
                addUnique(line, r, c);
                addUnique(line, -r, -c);
            }
            result[o] = line.toArray(new int[0][]);
        }
        return result;
    }

    private static void addUnique(List<int[]> line, int r, int c) {
        for (int[] existing : line) {
            if (existing[0] == r && existing[1] == c) {
                return;
            }
        }
        line.add(new int[] { r, c });
    }
}
