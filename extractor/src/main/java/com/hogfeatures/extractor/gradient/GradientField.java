package com.hogfeatures.extractor.gradient;

import com.hogfeatures.extractor.GrayImage;

/**
 * Centered differences of an image together with the derived magnitude and
 * orientation. All four grids share the source image's shape.
 */
public class GradientField {
    private final GrayImage vertical;
    private final GrayImage horizontal;
    private final GrayImage magnitude;
    private final GrayImage orientation;
    private final boolean signed;

    public GradientField(GrayImage vertical, GrayImage horizontal, GrayImage magnitude, GrayImage orientation,
            boolean signed) {
        this.vertical = vertical;
        this.horizontal = horizontal;
        this.magnitude = magnitude;
        this.orientation = orientation;
        this.signed = signed;
    }

    /** imv[r,c] = image[r+1,c] - image[r-1,c], zero on the top and bottom rows. */
    public GrayImage getVertical() {
        return vertical;
    }

    /** imh[r,c] = image[r,c+1] - image[r,c-1], zero on the left and right columns. */
    public GrayImage getHorizontal() {
        return horizontal;
    }

    public GrayImage getMagnitude() {
        return magnitude;
    }

    /** Degrees, in [0, 180) or [0, 360) when {@link #isSigned()}. */
    public GrayImage getOrientation() {
        return orientation;
    }

    public boolean isSigned() {
        return signed;
    }

    public double getOrientationRange() {
        return orientationRange(signed);
    }

    public static double orientationRange(boolean signed) {
        return signed ? 360.0 : 180.0;
    }
}
