package com.droidassist.extraction;

import lombok.Value;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Screen rectangle of a layout node, in device pixels.
 */
@Value
public class BoundingBox {

    private static final Pattern BOUNDS = Pattern.compile("\\[(\\d+),(\\d+)]\\[(\\d+),(\\d+)]");

    int left;
    int top;
    int right;
    int bottom;

    /**
     * Parses the uiautomator form "[x1,y1][x2,y2]". Empty and all-zero bounds yield empty.
     */
    public static Optional<BoundingBox> parse(String bounds) {
        if (bounds == null) {
            return Optional.empty();
        }
        Matcher m = BOUNDS.matcher(bounds.strip());
        if (!m.matches()) {
            return Optional.empty();
        }
        BoundingBox box = new BoundingBox(
            Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)),
            Integer.parseInt(m.group(3)), Integer.parseInt(m.group(4)));
        return box.isEmpty() ? Optional.empty() : Optional.of(box);
    }

    public int centerX() {
        return (left + right) / 2;
    }

    public int centerY() {
        return (top + bottom) / 2;
    }

    public boolean isEmpty() {
        return right <= left && bottom <= top;
    }

    @Override
    public String toString() {
        return "[" + left + "," + top + "][" + right + "," + bottom + "]";
    }
}
