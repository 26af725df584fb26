package com.hogfeatures.extractor;

import java.awt.image.BufferedImage;
import java.util.Arrays;

/**
 * A single-channel image of real samples stored row-major. Immutable: every
 * accessor that hands out the backing data returns a copy.
 */
public class GrayImage {
    private final int width;
    private final int height;
    // samples[r * width + c]
    private final double[] samples;

    private GrayImage(int width, int height, double[] samples) {
        this.width = width;
        this.height = height;
        this.samples = samples;
    }

    /**
     * Wraps a copy of row-major sample data.
     */
    public static GrayImage of(int width, int height, double[] samples) {
        InvalidArgumentException.requirePositive("width", width);
        InvalidArgumentException.requirePositive("height", height);
        if (samples == null || samples.length != width * height) {
            throw new InvalidArgumentException("samples must have length width*height = " + (width * height)
                    + ", got " + (samples == null ? "null" : samples.length));
        }
        for (int i = 0; i < samples.length; i++) {
            if (!Double.isFinite(samples[i])) {
                throw new InvalidArgumentException("samples must be finite, found " + samples[i] + " at index " + i);
            }
        }
        return new GrayImage(width, height, samples.clone());
    }

    /**
     * Builds an image from pixel rows, {@code pixels[row][col]}, typically 8-bit
     * grayscale values in [0, 255].
     */
    public static GrayImage fromPixels(int[][] pixels) {
        if (pixels == null || pixels.length == 0 || pixels[0] == null || pixels[0].length == 0) {
            throw new InvalidArgumentException("pixels must have at least one row and one column");
        }
        int h = pixels.length;
        int w = pixels[0].length;
        double[] data = new double[w * h];
        for (int r = 0; r < h; r++) {
            if (pixels[r] == null || pixels[r].length != w) {
                throw new InvalidArgumentException("pixel row " + r + " must have length " + w);
            }
            for (int c = 0; c < w; c++) {
                data[r * w + c] = pixels[r][c];
            }
        }
        return new GrayImage(w, h, data);
    }

    /**
     * Converts a decoded image to grayscale by averaging its RGB channels.
     */
    public static GrayImage fromBufferedImage(BufferedImage bi) {
        if (bi == null) {
            throw new InvalidArgumentException("image must not be null");
        }
        int w = bi.getWidth();
        int h = bi.getHeight();
        double[] data = new double[w * h];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int clr = bi.getRGB(x, y);
                int red = (clr & 0x00ff0000) >> 16;
                int green = (clr & 0x0000ff00) >> 8;
                int blue = clr & 0x000000ff;
                data[y * w + x] = (red + green + blue) / 3;
            }
        }
        return new GrayImage(w, h, data);
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public double get(int row, int col) {
        return samples[row * width + col];
    }

    public double[] toArray() {
        return samples.clone();
    }

    /**
     * Renders samples in [0, 1] as 8-bit grayscale.
     */
    public BufferedImage toBufferedImage() {
        return toBufferedImage(1.0);
    }

    /**
     * Renders the image as 8-bit grayscale, mapping [0, maxValue] linearly onto
     * [0, 255] and clamping anything outside.
     */
    public BufferedImage toBufferedImage(double maxValue) {
        BufferedImage bi = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
        double scale = maxValue > 0 ? 255.0 / maxValue : 0.0;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int v = (int) Math.round(samples[y * width + x] * scale);
                v = Math.max(0, Math.min(255, v));
                bi.getRaster().setSample(x, y, 0, v);
            }
        }
        return bi;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof GrayImage))
            return false;
        GrayImage other = (GrayImage) o;
        return width == other.width && height == other.height && Arrays.equals(samples, other.samples);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(samples);
    }

    @Override
    public String toString() {
        return "GrayImage{" + width + "x" + height + '}';
    }
}
