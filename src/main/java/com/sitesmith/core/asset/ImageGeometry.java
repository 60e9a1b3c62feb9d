package com.sitesmith.core.asset;

/**
 * Pixel dimensions of an image with its reduced aspect ratio.
 *
 * @param aspectRatio ratio reduced by the greatest common divisor, e.g. {@code 16:9}
 * @param orientation {@code landscape}, {@code portrait} or {@code square}
 */
public record ImageGeometry(int width, int height, String aspectRatio, String orientation) {

    public static ImageGeometry of(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Image dimensions must be positive: " + width + "x" + height);
        }
        int divisor = gcd(width, height);
        String orientation;
        if (width == height) {
            orientation = "square";
        } else if (width > height) {
            orientation = "landscape";
        } else {
            orientation = "portrait";
        }
        return new ImageGeometry(width, height, (width / divisor) + ":" + (height / divisor), orientation);
    }

    /** Caption line appended to every asset description. */
    public String describe() {
        return "Aspect Ratio: " + aspectRatio + " (" + orientation + ")";
    }

    private static int gcd(int a, int b) {
        while (b != 0) {
            int t = a % b;
            a = b;
            b = t;
        }
        return a;
    }
}
