package com.hogfeatures.extractor.block;

import com.hogfeatures.extractor.InvalidArgumentException;
import com.hogfeatures.extractor.histogram.CellHistogramGrid;
import com.hogfeatures.util.MathUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Groups cells into overlapping blocks (stride one cell) and normalizes each
 * block's concatenated histograms.
 */
public class BlockNormalizer {
    private static final Logger logger = LoggerFactory.getLogger(BlockNormalizer.class);

    public static final double DEFAULT_EPSILON = 1e-5;
    public static final double DEFAULT_L2_HYS_CLIP = 0.2;

    private final BlockNorm norm;
    private final double epsilon;
    private final double l2HysClip;

    public BlockNormalizer(BlockNorm norm) {
        this(norm, DEFAULT_EPSILON, DEFAULT_L2_HYS_CLIP);
    }

    public BlockNormalizer(BlockNorm norm, double epsilon, double l2HysClip) {
        if (norm == null) {
            throw new InvalidArgumentException("block norm must not be null");
        }
        if (!(epsilon > 0)) {
            throw new InvalidArgumentException("epsilon must be positive, got " + epsilon);
        }
        if (!(l2HysClip > 0)) {
            throw new InvalidArgumentException("l2HysClip must be positive, got " + l2HysClip);
        }
        this.norm = norm;
        this.epsilon = epsilon;
        this.l2HysClip = l2HysClip;
    }

    public BlockNorm getNorm() {
        return norm;
    }

    public BlockGrid normalize(CellHistogramGrid cells, int cellsPerBlockX, int cellsPerBlockY) {
        InvalidArgumentException.requirePositive("cellsPerBlock.x", cellsPerBlockX);
        InvalidArgumentException.requirePositive("cellsPerBlock.y", cellsPerBlockY);

        int orientations = cells.getOrientations();
        int blocksX = blockCount(cells.getCellsX(), cellsPerBlockX);
        int blocksY = blockCount(cells.getCellsY(), cellsPerBlockY);
        int blockLength = cellsPerBlockY * cellsPerBlockX * orientations;

        double[] out = new double[blocksY * blocksX * blockLength];
        double[] v = new double[blockLength];

        for (int by = 0; by < blocksY; by++) {
            for (int bx = 0; bx < blocksX; bx++) {
                int pos = 0;
                for (int cy = 0; cy < cellsPerBlockY; cy++) {
                    for (int cx = 0; cx < cellsPerBlockX; cx++) {
                        cells.copyHistogram(by + cy, bx + cx, v, pos);
                        pos += orientations;
                    }
                }
                normalizeInPlace(v);
                System.arraycopy(v, 0, out, (by * blocksX + bx) * blockLength, blockLength);
            }
        }

        if (blocksY == 0 || blocksX == 0) {
            logger.debug("Block {}x{} does not fit in {}x{} cell grid, no blocks produced", cellsPerBlockY,
                    cellsPerBlockX, cells.getCellsY(), cells.getCellsX());
        }
        return new BlockGrid(blocksY, blocksX, blockLength, out);
    }

    /**
     * Applies this normalizer's scheme to one block vector in place.
     */
    public void normalizeInPlace(double[] v) {
        switch (norm) {
            case L1:
                MathUtil.divideInPlace(v, MathUtil.sum(v) + epsilon);
                break;
            case L1_SQRT:
                MathUtil.divideInPlace(v, MathUtil.sum(v) + epsilon);
                MathUtil.sqrtInPlace(v);
                break;
            case L2:
                l2InPlace(v);
                break;
            case L2_HYS:
                l2InPlace(v);
                MathUtil.clipInPlace(v, l2HysClip);
                l2InPlace(v);
                break;
            default:
                throw new IllegalStateException("Unhandled block norm " + norm);
        }
    }

    private void l2InPlace(double[] v) {
        MathUtil.divideInPlace(v, Math.sqrt(MathUtil.sumOfSquares(v) + epsilon * epsilon));
    }

    /**
     * Number of stride-one block positions along an axis, zero when the block
     * is wider than the cell grid.
     */
    public static int blockCount(int cells, int cellsPerBlock) {
        return Math.max(0, cells - cellsPerBlock + 1);
    }
}
