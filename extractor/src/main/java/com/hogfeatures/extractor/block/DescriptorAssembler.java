package com.hogfeatures.extractor.block;

/**
 * Flattens a block grid into the final feature vector: block rows outermost,
 * then block columns, then each block's own cell-row, cell-column, bin order.
 */
public class DescriptorAssembler {

    public static double[] assemble(BlockGrid blocks) {
        int blockLength = blocks.getBlockLength();
        double[] descriptor = new double[blocks.getBlockCount() * blockLength];
        int pos = 0;
        for (int by = 0; by < blocks.getBlocksY(); by++) {
            for (int bx = 0; bx < blocks.getBlocksX(); bx++) {
                System.arraycopy(blocks.block(by, bx), 0, descriptor, pos, blockLength);
                pos += blockLength;
            }
        }
        return descriptor;
    }

    public static int descriptorLength(int blocksY, int blocksX, int cellsPerBlockY, int cellsPerBlockX,
            int orientations) {
        return blocksY * blocksX * cellsPerBlockY * cellsPerBlockX * orientations;
    }
}
