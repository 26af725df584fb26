package com.hogfeatures.extractor.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.hogfeatures.extractor.block.BlockNormalizer;
import com.hogfeatures.extractor.visual.Visualizer;

/**
 * Extraction settings. Public fields so the object binds directly from
 * hog_config.json; defaults follow the usual HOG setup (9 bins, 8x8 cells,
 * 3x3 blocks, L1).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class HogParameters {

    /** A (x, y) pair: x along image width, y along image height. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Span {
        public int x;
        public int y;

        public Span() {
        }

        public Span(int x, int y) {
            this.x = x;
            this.y = y;
        }

        public Span copy() {
            return new Span(x, y);
        }

        @Override
        public String toString() {
            return "(" + x + ", " + y + ")";
        }
    }

    public int orientations = 9;
    public Span pixelsPerCell = new Span(8, 8);
    public Span cellsPerBlock = new Span(3, 3);
    public String blockNorm = "L1";
    public boolean signedOrientation = false;
    public boolean transformSqrt = false;
    // Divide cell histograms by the cell area before block normalization.
    public boolean averageCellHistograms = true;
    public boolean visualize = false;
    public boolean requireAtLeastOneBlock = false;
    public double epsilon = BlockNormalizer.DEFAULT_EPSILON;
    public double l2HysClip = BlockNormalizer.DEFAULT_L2_HYS_CLIP;
    public double visualizationMaxIntensity = Visualizer.DEFAULT_MAX_INTENSITY;

    public HogParameters() {
    }

    public HogParameters(int orientations, int pixelsPerCellX, int pixelsPerCellY, int cellsPerBlockX,
            int cellsPerBlockY, String blockNorm, boolean visualize) {
        this.orientations = orientations;
        this.pixelsPerCell = new Span(pixelsPerCellX, pixelsPerCellY);
        this.cellsPerBlock = new Span(cellsPerBlockX, cellsPerBlockY);
        this.blockNorm = blockNorm;
        this.visualize = visualize;
    }

    public static HogParameters defaults() {
        return new HogParameters();
    }

    /**
     * Square cells of {@code cellSpan} pixels and square blocks of
     * {@code blockSpan} cells.
     */
    public static HogParameters square(int orientations, int cellSpan, int blockSpan, String blockNorm) {
        return new HogParameters(orientations, cellSpan, cellSpan, blockSpan, blockSpan, blockNorm, false);
    }

    public HogParameters copy() {
        HogParameters p = new HogParameters();
        p.orientations = this.orientations;
        p.pixelsPerCell = this.pixelsPerCell != null ? this.pixelsPerCell.copy() : null;
        p.cellsPerBlock = this.cellsPerBlock != null ? this.cellsPerBlock.copy() : null;
        p.blockNorm = this.blockNorm;
        p.signedOrientation = this.signedOrientation;
        p.transformSqrt = this.transformSqrt;
        p.averageCellHistograms = this.averageCellHistograms;
        p.visualize = this.visualize;
        p.requireAtLeastOneBlock = this.requireAtLeastOneBlock;
        p.epsilon = this.epsilon;
        p.l2HysClip = this.l2HysClip;
        p.visualizationMaxIntensity = this.visualizationMaxIntensity;
        return p;
    }

    @Override
    public String toString() {
        return "HogParameters{" +
                "orientations=" + orientations +
                ", pixelsPerCell=" + pixelsPerCell +
                ", cellsPerBlock=" + cellsPerBlock +
                ", blockNorm='" + blockNorm + '\'' +
                ", signed=" + signedOrientation +
                ", transformSqrt=" + transformSqrt +
                ", averageCells=" + averageCellHistograms +
                ", visualize=" + visualize +
                '}';
    }
}
