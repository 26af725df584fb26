package com.hogfeatures.extractor;

/**
 * Deterministic synthetic test images. Sample (r, c) is |sin(r * width + c)|,
 * i.e. |sin| of the linear pixel index in row-major order.
 */
public class ImageSynthesizer {

    public static GrayImage synthesize(int width, int height) {
        InvalidArgumentException.requirePositive("width", width);
        InvalidArgumentException.requirePositive("height", height);

        double[] samples = new double[width * height];
        for (int r = 0; r < height; r++) {
            for (int c = 0; c < width; c++) {
                int idx = r * width + c;
                samples[idx] = Math.abs(Math.sin(idx));
            }
        }
        return GrayImage.of(width, height, samples);
    }
}
