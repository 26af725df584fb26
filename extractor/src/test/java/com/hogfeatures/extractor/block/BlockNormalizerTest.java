package com.hogfeatures.extractor.block;

import com.hogfeatures.extractor.ImageSynthesizer;
import com.hogfeatures.extractor.InvalidArgumentException;
import com.hogfeatures.extractor.gradient.GradientComputer;
import com.hogfeatures.extractor.histogram.CellHistogramBuilder;
import com.hogfeatures.extractor.histogram.CellHistogramGrid;
import com.hogfeatures.util.MathUtil;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class BlockNormalizerTest {

    private static CellHistogramGrid syntheticCells(int w, int h, int cell, int bins) {
        return CellHistogramBuilder.build(GradientComputer.compute(ImageSynthesizer.synthesize(w, h), false), cell,
                cell, bins);
    }

    @Test
    public void testL2AndL2HysGiveUnitNorm() {
        CellHistogramGrid cells = syntheticCells(32, 24, 4, 9);
        for (BlockNorm norm : new BlockNorm[] { BlockNorm.L2, BlockNorm.L2_HYS }) {
            BlockGrid blocks = new BlockNormalizer(norm).normalize(cells, 2, 2);
            assertFalse(blocks.isEmpty());
            for (int by = 0; by < blocks.getBlocksY(); by++) {
                for (int bx = 0; bx < blocks.getBlocksX(); bx++) {
                    double[] v = blocks.block(by, bx);
                    assertEquals(1.0, Math.sqrt(MathUtil.sumOfSquares(v)), 1e-6, norm + " block " + by + "," + bx);
                }
            }
        }
    }

    @Test
    public void testL2HysClipsBeforeRenormalizing() {
        // One dominant bin: plain L2 gives ~1.0 there; hysteresis clips it to the
        // ceiling first, so after renormalizing it no longer dominates as much.
        double[] v = { 10.0, 1.0, 1.0, 1.0 };
        double[] l2 = v.clone();
        new BlockNormalizer(BlockNorm.L2).normalizeInPlace(l2);
        double[] hys = v.clone();
        new BlockNormalizer(BlockNorm.L2_HYS).normalizeInPlace(hys);

        assertTrue(hys[0] < l2[0]);
        assertTrue(hys[1] > l2[1]);
        // Renormalizing rescales uniformly, so the clipped/unclipped ratio is kept.
        assertEquals(0.2 / (l2[1]), hys[0] / hys[1], 1e-6);
        assertEquals(1.0, Math.sqrt(MathUtil.sumOfSquares(hys)), 1e-6);
    }

    @Test
    public void testL1AndL1Sqrt() {
        double[] v = { 1.0, 3.0, 0.0, 4.0 };
        double[] l1 = v.clone();
        new BlockNormalizer(BlockNorm.L1).normalizeInPlace(l1);
        assertEquals(1.0, MathUtil.sum(l1), 1e-5);
        assertEquals(3.0 / (8.0 + 1e-5), l1[1], 1e-15);

        double[] l1sqrt = v.clone();
        new BlockNormalizer(BlockNorm.L1_SQRT).normalizeInPlace(l1sqrt);
        assertEquals(Math.sqrt(3.0 / (8.0 + 1e-5)), l1sqrt[1], 1e-15);
        assertEquals(1.0, MathUtil.sumOfSquares(l1sqrt), 1e-5);
    }

    @Test
    public void testZeroBlockStaysZero() {
        for (BlockNorm norm : BlockNorm.values()) {
            double[] v = new double[18];
            new BlockNormalizer(norm).normalizeInPlace(v);
            for (double x : v) {
                assertEquals(0.0, x, 0.0, norm.toString());
                assertFalse(Double.isNaN(x));
            }
        }
    }

    @Test
    public void testCustomEpsilonAndClip() {
        double[] v = { 1.0, 1.0 };
        new BlockNormalizer(BlockNorm.L1, 1.0, 0.2).normalizeInPlace(v);
        assertArrayEquals(new double[] { 1.0 / 3.0, 1.0 / 3.0 }, v, 1e-15);

        assertThrows(InvalidArgumentException.class, () -> new BlockNormalizer(BlockNorm.L1, 0.0, 0.2));
        assertThrows(InvalidArgumentException.class, () -> new BlockNormalizer(BlockNorm.L2_HYS, 1e-5, -1));
        assertThrows(InvalidArgumentException.class, () -> new BlockNormalizer(null));
    }

    @Test
    public void testBlockGridShapeAndOverlap() {
        // 3 columns x 2 rows of cells, 2 bins each, bins numbered so every cell is identifiable.
        double[] bins = new double[3 * 2 * 2];
        for (int i = 0; i < bins.length; i++) {
            bins[i] = i + 1;
        }
        CellHistogramGrid cells = new CellHistogramGrid(2, 3, 2, bins);

        BlockGrid blocks = new BlockNormalizer(BlockNorm.L1).normalize(cells, 2, 2);
        assertEquals(1, blocks.getBlocksY());
        assertEquals(2, blocks.getBlocksX());
        assertEquals(8, blocks.getBlockLength());

        // Block (0,1) covers cells (0,1), (0,2), (1,1), (1,2) in that order.
        double[] raw = { 3, 4, 5, 6, 9, 10, 11, 12 };
        double sum = MathUtil.sum(raw) + BlockNormalizer.DEFAULT_EPSILON;
        double[] block = blocks.block(0, 1);
        for (int i = 0; i < raw.length; i++) {
            assertEquals(raw[i] / sum, block[i], 1e-15);
        }
    }

    @Test
    public void testBlockLargerThanGridGivesNoBlocks() {
        CellHistogramGrid cells = syntheticCells(8, 8, 4, 9);
        BlockGrid blocks = new BlockNormalizer(BlockNorm.L1).normalize(cells, 3, 2);
        assertTrue(blocks.isEmpty());
        assertEquals(0, blocks.getBlocksX());
        assertEquals(1, blocks.getBlocksY());
        assertEquals(0, DescriptorAssembler.assemble(blocks).length);
    }

    @Test
    public void testRejectsNonPositiveBlockSize() {
        CellHistogramGrid cells = syntheticCells(8, 8, 4, 9);
        BlockNormalizer normalizer = new BlockNormalizer(BlockNorm.L2);
        assertThrows(InvalidArgumentException.class, () -> normalizer.normalize(cells, 0, 2));
        assertThrows(InvalidArgumentException.class, () -> normalizer.normalize(cells, 2, -1));
    }
}
