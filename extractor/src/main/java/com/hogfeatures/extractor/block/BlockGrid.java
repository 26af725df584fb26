package com.hogfeatures.extractor.block;

import java.util.Arrays;

/**
 * Normalized block vectors laid out as [blocksY][blocksX][blockLength], where
 * each vector is itself [cellsPerBlockY][cellsPerBlockX][orientations].
 */
public class BlockGrid {
    private final int blocksY;
    private final int blocksX;
    private final int blockLength;
    private final double[] values;

    public BlockGrid(int blocksY, int blocksX, int blockLength, double[] values) {
        if (values == null || values.length != blocksY * blocksX * blockLength) {
            throw new IllegalArgumentException("values must have length blocksY*blocksX*blockLength");
        }
        this.blocksY = blocksY;
        this.blocksX = blocksX;
        this.blockLength = blockLength;
        this.values = values.clone();
    }

    public int getBlocksY() {
        return blocksY;
    }

    public int getBlocksX() {
        return blocksX;
    }

    public int getBlockLength() {
        return blockLength;
    }

    public int getBlockCount() {
        return blocksY * blocksX;
    }

    public boolean isEmpty() {
        return getBlockCount() == 0;
    }

    public double[] block(int blockY, int blockX) {
        if (blockY < 0 || blockY >= blocksY || blockX < 0 || blockX >= blocksX) {
            throw new IndexOutOfBoundsException(
                    "block (" + blockY + ", " + blockX + ") outside " + blocksY + "x" + blocksX);
        }
        int head = (blockY * blocksX + blockX) * blockLength;
        return Arrays.copyOfRange(values, head, head + blockLength);
    }
}
