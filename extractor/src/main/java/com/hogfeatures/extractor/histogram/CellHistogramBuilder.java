package com.hogfeatures.extractor.histogram;

import com.hogfeatures.extractor.GrayImage;
import com.hogfeatures.extractor.InvalidArgumentException;
import com.hogfeatures.extractor.gradient.GradientField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Accumulates magnitude-weighted orientation histograms over non-overlapping
 * cells.
 *
 * The orientation range is split into {@code orientations} equal bins, bin i
 * centered at (i + 0.5) * binWidth. Each pixel's magnitude is shared between
 * the two nearest bin centers in proportion to its angular distance from them,
 * wrapping around the ends of the range. A pixel sitting exactly on a center
 * votes entirely into that bin.
 *
 * Cells are ph x pw pixels. The grid has floor(H / ph) rows and floor(W / pw)
 * columns; remainder pixels on the bottom and right are not counted anywhere.
 */
public class CellHistogramBuilder {
    private static final Logger logger = LoggerFactory.getLogger(CellHistogramBuilder.class);

    public static CellHistogramGrid build(GradientField field, int pixelsPerCellX, int pixelsPerCellY,
            int orientations) {
        return build(field.getMagnitude(), field.getOrientation(), pixelsPerCellX, pixelsPerCellY, orientations,
                field.isSigned());
    }

    public static CellHistogramGrid build(GrayImage magnitude, GrayImage orientation, int pixelsPerCellX,
            int pixelsPerCellY, int orientations, boolean signed) {
        validate(pixelsPerCellX, pixelsPerCellY, orientations);
        if (magnitude.getWidth() != orientation.getWidth() || magnitude.getHeight() != orientation.getHeight()) {
            throw new InvalidArgumentException("magnitude and orientation fields must have the same shape");
        }

        int w = magnitude.getWidth();
        int h = magnitude.getHeight();
        int cellsX = w / pixelsPerCellX;
        int cellsY = h / pixelsPerCellY;

        double binWidth = GradientField.orientationRange(signed) / orientations;
        double[] mag = magnitude.toArray();
        double[] ori = orientation.toArray();

        // [cellY][cellX][bin]
        double[] bins = new double[cellsY * cellsX * orientations];

        for (int cellY = 0; cellY < cellsY; cellY++) {
            for (int cellX = 0; cellX < cellsX; cellX++) {
                int head = (cellY * cellsX + cellX) * orientations;
                int r0 = cellY * pixelsPerCellY;
                int c0 = cellX * pixelsPerCellX;
                for (int r = r0; r < r0 + pixelsPerCellY; r++) {
                    for (int c = c0; c < c0 + pixelsPerCellX; c++) {
                        int idx = r * w + c;
                        vote(bins, head, orientations, binWidth, ori[idx], mag[idx]);
                    }
                }
            }
        }

        logger.debug("Built {}x{} cell grid ({} bins) from {}x{} image", cellsY, cellsX, orientations, h, w);
        return new CellHistogramGrid(cellsY, cellsX, orientations, bins);
    }

    /**
     * Splits {@code weight} between the two bins whose centers bracket
     * {@code angle}.
     */
    static void vote(double[] bins, int head, int orientations, double binWidth, double angle, double weight) {
        // Position in bin-center units: 0.0 is the center of bin 0.
        double pos = angle / binWidth - 0.5;
        int lower = (int) Math.floor(pos);
        double frac = pos - lower;

        int lowerBin = Math.floorMod(lower, orientations);
        if (frac == 0.0) {
            bins[head + lowerBin] += weight;
            return;
        }
        int upperBin = Math.floorMod(lower + 1, orientations);
        bins[head + lowerBin] += weight * (1.0 - frac);
        bins[head + upperBin] += weight * frac;
    }

    static void validate(int pixelsPerCellX, int pixelsPerCellY, int orientations) {
        InvalidArgumentException.requirePositive("pixelsPerCell.x", pixelsPerCellX);
        InvalidArgumentException.requirePositive("pixelsPerCell.y", pixelsPerCellY);
        InvalidArgumentException.requirePositive("orientations", orientations);
    }
}
