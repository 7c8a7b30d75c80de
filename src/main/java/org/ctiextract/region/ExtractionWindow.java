package org.ctiextract.region;

import java.util.Objects;

/**
 * The pixel range extracted relative to an anchor edge of a region.
 * <p>
 * Three forms exist:
 * <ul>
 *   <li>{@link #pixels(int, int)}: an explicit range {@code [start, end)} measured from the
 *       anchor edge. {@code start} may be negative (pixels in front of the anchor) and
 *       {@code end} may exceed the region.</li>
 *   <li>{@link #fromEnd(int)}: the last {@code count} pixels of the anchored span, so the
 *       extracted size equals {@code count} whatever the region size.</li>
 *   <li>{@link #full()}: the whole anchored span.</li>
 * </ul>
 * For a leading edge the anchored span is the region itself; for a trailing edge it is the
 * space between the region's far edge and the next region (or the far edge of the grid).
 */
public final class ExtractionWindow {

    /**
     * The form of a window.
     */
    public enum Form {
        /** Explicit relative range. */
        PIXELS,
        /** Fixed count measured back from the end of the anchored span. */
        FROM_END,
        /** The entire anchored span. */
        FULL
    }

    private static final ExtractionWindow FULL = new ExtractionWindow(Form.FULL, 0, 0);

    private final Form form;
    private final int start;
    private final int end;

    private ExtractionWindow(Form form, int start, int end) {
        this.form = form;
        this.start = start;
        this.end = end;
    }

    /**
     * Creates an explicit relative window.
     *
     * @param start First pixel relative to the anchor edge (inclusive, may be negative).
     * @param end Last pixel relative to the anchor edge (exclusive).
     * @return The window.
     * @throws InvalidRegionException if {@code start >= end}.
     */
    public static ExtractionWindow pixels(int start, int end) {
        if (start >= end) {
            throw new InvalidRegionException(
                "Extraction window start must be smaller than its end, got (" + start + ", " + end + ")");
        }
        return new ExtractionWindow(Form.PIXELS, start, end);
    }

    /**
     * Creates a self-scaling window of the last {@code count} pixels of the anchored span.
     *
     * @param count Number of pixels, must be positive.
     * @return The window.
     * @throws InvalidRegionException if {@code count <= 0}.
     */
    public static ExtractionWindow fromEnd(int count) {
        if (count <= 0) {
            throw new InvalidRegionException("pixels-from-end must be positive, got " + count);
        }
        return new ExtractionWindow(Form.FROM_END, count, count);
    }

    /**
     * @return The window covering the whole anchored span.
     */
    public static ExtractionWindow full() {
        return FULL;
    }

    public Form getForm() {
        return form;
    }

    /**
     * @return The relative start of a {@link Form#PIXELS} window.
     * @throws IllegalStateException for other forms.
     */
    public int getStart() {
        requireForm(Form.PIXELS);
        return start;
    }

    /**
     * @return The relative end of a {@link Form#PIXELS} window.
     * @throws IllegalStateException for other forms.
     */
    public int getEnd() {
        requireForm(Form.PIXELS);
        return end;
    }

    /**
     * @return The pixel count of a {@link Form#FROM_END} window.
     * @throws IllegalStateException for other forms.
     */
    public int getCount() {
        requireForm(Form.FROM_END);
        return start;
    }

    /**
     * Resolves this window into absolute coordinates along one axis.
     *
     * @param anchor The edge the window is measured from.
     * @param near Near edge of the region along the axis.
     * @param far Far edge of the region along the axis (exclusive).
     * @param trailingSpace Pixels between {@code far} and the next structure; only used for
     *                      {@link EdgeAnchor#TRAILING}.
     * @return {@code {start, end}} in absolute pixel coordinates.
     */
    int[] resolve(EdgeAnchor anchor, int near, int far, int trailingSpace) {
        final int origin = anchor == EdgeAnchor.LEADING ? near : far;
        final int span = anchor == EdgeAnchor.LEADING ? far - near : trailingSpace;
        return switch (form) {
            case PIXELS -> new int[]{origin + start, origin + end};
            case FROM_END -> new int[]{origin + span - start, origin + span};
            case FULL -> new int[]{origin, origin + span};
        };
    }

    private void requireForm(Form expected) {
        if (form != expected) {
            throw new IllegalStateException("Window is " + form + ", not " + expected);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExtractionWindow that)) return false;
        return form == that.form && start == that.start && end == that.end;
    }

    @Override
    public int hashCode() {
        return Objects.hash(form, start, end);
    }

    @Override
    public String toString() {
        return switch (form) {
            case PIXELS -> "pixels(" + start + ", " + end + ")";
            case FROM_END -> "fromEnd(" + start + ")";
            case FULL -> "full()";
        };
    }
}
