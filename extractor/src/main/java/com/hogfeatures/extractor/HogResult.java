package com.hogfeatures.extractor;

import java.util.Optional;

public class HogResult {
    private final double[] descriptor;
    private final GrayImage visualization;
    private final int blocksY;
    private final int blocksX;

    public HogResult(double[] descriptor, GrayImage visualization, int blocksY, int blocksX) {
        this.descriptor = descriptor.clone();
        this.visualization = visualization;
        this.blocksY = blocksY;
        this.blocksX = blocksX;
    }

    /** The flattened feature vector. Empty when no block fits the image. */
    public double[] getDescriptor() {
        return descriptor.clone();
    }

    public int getDescriptorLength() {
        return descriptor.length;
    }

    /** Present only when visualization was requested. */
    public Optional<GrayImage> getVisualization() {
        return Optional.ofNullable(visualization);
    }

    public int getBlocksY() {
        return blocksY;
    }

    public int getBlocksX() {
        return blocksX;
    }

    public boolean isEmpty() {
        return descriptor.length == 0;
    }

    @Override
    public String toString() {
        return "HogResult{" +
                "length=" + descriptor.length +
                ", blocks=" + blocksY + "x" + blocksX +
                ", visualization=" + (visualization != null) +
                '}';
    }
}
