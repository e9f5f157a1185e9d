package io.github.jbellis.mobilize.config;

import java.util.regex.Pattern;

/**
 * An opaque color with 8-bit channels.
 */
public record RgbColor(int red, int green, int blue) {

    private static final Pattern HEX_COLOR = Pattern.compile("#[0-9a-fA-F]{6}");

    public RgbColor {
        checkChannel("red", red);
        checkChannel("green", green);
        checkChannel("blue", blue);
    }

    /**
     * Parses a {@code #rrggbb} color.
     *
     * @throws InvalidOptionException if {@code hex} is not exactly that form
     */
    public static RgbColor fromHex(String hex) {
        if (!HEX_COLOR.matcher(hex).matches()) {
            throw new InvalidOptionException("color", "expected #rrggbb but got '" + hex + "'");
        }
        int rgb = Integer.parseInt(hex.substring(1), 16);
        return new RgbColor((rgb >> 16) & 0xff, (rgb >> 8) & 0xff, rgb & 0xff);
    }

    /**
     * Renders the color as a three element JavaScript array, e.g. {@code [255,0,0]}.
     */
    public String toJsArray() {
        return "[" + red + "," + green + "," + blue + "]";
    }

    private static void checkChannel(String name, int value) {
        if (value < 0 || value > 255) {
            throw new IllegalArgumentException(name + " channel out of range: " + value);
        }
    }
}
