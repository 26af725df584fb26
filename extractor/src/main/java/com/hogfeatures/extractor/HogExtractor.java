package com.hogfeatures.extractor;

import com.hogfeatures.extractor.block.BlockGrid;
import com.hogfeatures.extractor.block.BlockNorm;
import com.hogfeatures.extractor.block.BlockNormalizer;
import com.hogfeatures.extractor.block.DescriptorAssembler;
import com.hogfeatures.extractor.config.HogParameters;
import com.hogfeatures.extractor.gradient.GradientComputer;
import com.hogfeatures.extractor.gradient.GradientField;
import com.hogfeatures.extractor.histogram.CellHistogramBuilder;
import com.hogfeatures.extractor.histogram.CellHistogramGrid;
import com.hogfeatures.extractor.visual.Visualizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Histogram of Oriented Gradients extractor.
 *
 * Pipeline: gradients, per-cell soft-voted orientation histograms, overlapping
 * block normalization, flattening. When visualization is on, the cell
 * histograms are also rendered.
 *
 * All parameters are validated in the constructor, so a constructed extractor
 * only fails on a bad image. Instances are immutable and can be shared.
 */
public class HogExtractor {
    private static final Logger logger = LoggerFactory.getLogger(HogExtractor.class);

    private final HogParameters params;
    private final BlockNorm blockNorm;
    private final BlockNormalizer normalizer;
    private final Visualizer visualizer;

    public HogExtractor(HogParameters params) {
        this(params, true);
    }

    private HogExtractor(HogParameters params, boolean announce) {
        if (params == null) {
            throw new InvalidArgumentException("parameters must not be null");
        }
        if (params.pixelsPerCell == null || params.cellsPerBlock == null) {
            throw new InvalidArgumentException("pixelsPerCell and cellsPerBlock must be set");
        }
        InvalidArgumentException.requirePositive("orientations", params.orientations);
        InvalidArgumentException.requirePositive("pixelsPerCell.x", params.pixelsPerCell.x);
        InvalidArgumentException.requirePositive("pixelsPerCell.y", params.pixelsPerCell.y);
        InvalidArgumentException.requirePositive("cellsPerBlock.x", params.cellsPerBlock.x);
        InvalidArgumentException.requirePositive("cellsPerBlock.y", params.cellsPerBlock.y);

        this.params = params.copy();
        this.blockNorm = BlockNorm.fromName(params.blockNorm);
        this.normalizer = new BlockNormalizer(blockNorm, params.epsilon, params.l2HysClip);
        this.visualizer = params.visualize ? new Visualizer(params.visualizationMaxIntensity) : null;

        String format = "HogExtractor: orientations={}, pixelsPerCell={}, cellsPerBlock={}, blockNorm={}, signed={}, "
                + "transformSqrt={}, visualize={}";
        Object[] args = { params.orientations, params.pixelsPerCell, params.cellsPerBlock, blockNorm,
                params.signedOrientation, params.transformSqrt, params.visualize };
        // one-shot extractors are built per call, so they stay quiet at INFO
        if (announce) {
            logger.info(format, args);
        } else {
            logger.debug(format, args);
        }
    }

    /**
     * One-shot extraction with explicit parameters and defaults for everything
     * else.
     */
    public static HogResult extract(GrayImage image, int orientations, int pixelsPerCellX, int pixelsPerCellY,
            int cellsPerBlockX, int cellsPerBlockY, String blockNorm, boolean visualize) {
        HogParameters p = new HogParameters(orientations, pixelsPerCellX, pixelsPerCellY, cellsPerBlockX,
                cellsPerBlockY, blockNorm, visualize);
        return new HogExtractor(p, false).extract(image);
    }

    public HogParameters getParameters() {
        return params.copy();
    }

    public BlockNorm getBlockNorm() {
        return blockNorm;
    }

    public HogResult extract(GrayImage image) {
        if (image == null) {
            throw new InvalidArgumentException("image must not be null");
        }
        int w = image.getWidth();
        int h = image.getHeight();
        int blocksX = BlockNormalizer.blockCount(w / params.pixelsPerCell.x, params.cellsPerBlock.x);
        int blocksY = BlockNormalizer.blockCount(h / params.pixelsPerCell.y, params.cellsPerBlock.y);
        if (params.requireAtLeastOneBlock && (blocksX == 0 || blocksY == 0)) {
            throw new InvalidArgumentException("cellsPerBlock " + params.cellsPerBlock + " does not fit the "
                    + (h / params.pixelsPerCell.y) + "x" + (w / params.pixelsPerCell.x) + " cell grid of a " + w
                    + "x" + h + " image");
        }

        long start = System.nanoTime();

        GrayImage source = params.transformSqrt ? sqrtTransform(image) : image;
        GradientField gradients = GradientComputer.compute(source, params.signedOrientation);
        CellHistogramGrid cells = CellHistogramBuilder.build(gradients, params.pixelsPerCell.x,
                params.pixelsPerCell.y, params.orientations);

        CellHistogramGrid forBlocks = params.averageCellHistograms
                ? cells.scaled(1.0 / (params.pixelsPerCell.x * params.pixelsPerCell.y))
                : cells;
        BlockGrid blocks = normalizer.normalize(forBlocks, params.cellsPerBlock.x, params.cellsPerBlock.y);
        double[] descriptor = DescriptorAssembler.assemble(blocks);

        GrayImage visualization = null;
        if (visualizer != null) {
            visualization = visualizer.render(cells, w, h, params.pixelsPerCell.x, params.pixelsPerCell.y,
                    params.signedOrientation);
        }

        if (logger.isDebugEnabled()) {
            logger.debug("Extracted {} features from {}x{} image ({}x{} cells, {}x{} blocks) in {} us",
                    descriptor.length, w, h, cells.getCellsY(), cells.getCellsX(), blocks.getBlocksY(),
                    blocks.getBlocksX(), (System.nanoTime() - start) / 1000);
        }
        return new HogResult(descriptor, visualization, blocks.getBlocksY(), blocks.getBlocksX());
    }

    /**
     * Descriptor length for an image of the given size, without extracting.
     */
    public int descriptorSize(int width, int height) {
        InvalidArgumentException.requirePositive("width", width);
        InvalidArgumentException.requirePositive("height", height);
        int blocksX = BlockNormalizer.blockCount(width / params.pixelsPerCell.x, params.cellsPerBlock.x);
        int blocksY = BlockNormalizer.blockCount(height / params.pixelsPerCell.y, params.cellsPerBlock.y);
        return DescriptorAssembler.descriptorLength(blocksY, blocksX, params.cellsPerBlock.y,
                params.cellsPerBlock.x, params.orientations);
    }

    // Power-law (gamma 0.5) compression.
    static GrayImage sqrtTransform(GrayImage image) {
        double[] px = image.toArray();
        for (int i = 0; i < px.length; i++) {
            if (px[i] < 0) {
                throw new InvalidArgumentException(
                        "transformSqrt requires non-negative samples, found " + px[i] + " at index " + i);
            }
            px[i] = Math.sqrt(px[i]);
        }
        return GrayImage.of(image.getWidth(), image.getHeight(), px);
    }
}
