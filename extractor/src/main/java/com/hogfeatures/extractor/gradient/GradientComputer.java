package com.hogfeatures.extractor.gradient;

import com.hogfeatures.extractor.GrayImage;

/**
 * Per-pixel gradients using the centered [-1, 0, 1] kernel in both directions.
 * Pixels where the kernel would leave the image get a zero difference rather
 * than a one-sided one.
 */
public class GradientComputer {

    public static GradientField compute(GrayImage image, boolean signed) {
        int h = image.getHeight();
        int w = image.getWidth();
        double[] px = image.toArray();

        double[] imv = new double[w * h];
        double[] imh = new double[w * h];

        for (int r = 1; r < h - 1; r++) {
            for (int c = 0; c < w; c++) {
                imv[r * w + c] = px[(r + 1) * w + c] - px[(r - 1) * w + c];
            }
        }
        for (int r = 0; r < h; r++) {
            for (int c = 1; c < w - 1; c++) {
                imh[r * w + c] = px[r * w + c + 1] - px[r * w + c - 1];
            }
        }

        double[] mag = new double[w * h];
        double[] ori = new double[w * h];
        for (int i = 0; i < w * h; i++) {
            mag[i] = Math.hypot(imv[i], imh[i]);
            ori[i] = orientationDegrees(imv[i], imh[i], signed);
        }

        return new GradientField(
                GrayImage.of(w, h, imv),
                GrayImage.of(w, h, imh),
                GrayImage.of(w, h, mag),
                GrayImage.of(w, h, ori),
                signed);
    }

    /**
     * atan2(dy, dx) in degrees, folded into [0, 180) for unsigned gradients or
     * wrapped into [0, 360) for signed ones.
     */
    public static double orientationDegrees(double dy, double dx, boolean signed) {
        double range = GradientField.orientationRange(signed);
        // atan2 returns (-180, 180]
        double deg = Math.toDegrees(Math.atan2(dy, dx)) % range;
        if (deg < 0) {
            deg += range;
        }
        // A tiny negative angle can round up to exactly the range.
        if (deg >= range) {
            deg = 0.0;
        }
        // normalizes -0.0
        return deg + 0.0;
    }
}
