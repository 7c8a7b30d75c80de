package org.ctiextract.extract;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

import org.ctiextract.grid.Array1D;
import org.ctiextract.grid.ShapeMismatchException;
import org.ctiextract.grid.Statistic;
import org.ctiextract.random.IRandomProvider;
import org.ctiextract.region.EdgeAnchor;
import org.ctiextract.region.EmptyRegionListException;
import org.ctiextract.region.ExtractionWindow;
import org.ctiextract.region.Layout1D;
import org.ctiextract.region.Region1D;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;

/**
 * Extracts the regions of one {@link ExtractorKind1D} from lines of one {@link Layout1D}. The 1D
 * counterpart of {@link Extractor2D}.
 */
public class Extractor1D {

    private static final Logger LOG = LoggerFactory.getLogger(Extractor1D.class);

    private static final Comparator<Region1D> CANONICAL_ORDER = Comparator
        .comparingInt(Region1D::x0)
        .thenComparingInt(Region1D::x1);

    private final ExtractorKind1D kind;
    private final Layout1D layout;

    public Extractor1D(ExtractorKind1D kind, Layout1D layout) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.layout = Objects.requireNonNull(layout, "layout");
    }

    public ExtractorKind1D getKind() {
        return kind;
    }

    public Layout1D getLayout() {
        return layout;
    }

    /**
     * @param window The extraction window.
     * @return One region per parent structure, in layout order.
     * @throws org.ctiextract.region.InvalidRegionException if a derived region is degenerate or
     *         lies outside the line.
     */
    public List<Region1D> regionListFrom(ExtractionWindow window) {
        List<Region1D> derived = new ArrayList<>();
        for (Region1D parent : kind.parentRegionsFrom(layout)) {
            Region1D region = kind.getAnchor() == EdgeAnchor.LEADING
                ? parent.leadingRegionFrom(window)
                : parent.trailingRegionFrom(window, layout.trailingSpace(parent));
            region.checkWithin(layout.getLength());
            derived.add(region);
        }
        LOG.debug("{} derived {} regions for {}: {}", kind, derived.size(), window, derived);
        return Collections.unmodifiableList(derived);
    }

    /**
     * @param window The extraction window.
     * @param invert Flag every pixel outside the derived regions instead.
     * @return Flags of the line length.
     */
    public boolean[] maskFrom(ExtractionWindow window, boolean invert) {
        boolean[] mask = new boolean[layout.getLength()];
        for (Region1D region : regionListFrom(window)) {
            for (int i = region.x0(); i < region.x1(); i++) {
                mask[i] = true;
            }
        }
        if (invert) {
            for (int i = 0; i < mask.length; i++) {
                mask[i] = !mask[i];
            }
        }
        return mask;
    }

    public List<Array1D> patchListFrom(Array1D line, ExtractionWindow window) {
        requireLayoutLength(line, "Line");
        List<Array1D> patches = new ArrayList<>();
        for (Region1D region : regionListFrom(window)) {
            patches.add(line.slice(region));
        }
        return patches;
    }

    /**
     * Mask-aware mean of all patches; a pixel masked in every patch is masked in the result, with
     * value 0.
     *
     * @throws EmptyRegionListException if no region is derived.
     * @throws ShapeMismatchException if the derived regions differ in length.
     */
    public Array1D stackedFrom(Array1D line, ExtractionWindow window) {
        requireLayoutLength(line, "Line");
        List<Region1D> regions = new ArrayList<>(regionListFrom(window));
        if (regions.isEmpty()) {
            throw new EmptyRegionListException("stackedFrom needs at least one region, " + kind + " derived none");
        }
        regions.sort(CANONICAL_ORDER);
        int length = regions.get(0).totalPixels();
        double[] sums = new double[length];
        int[] counts = new int[length];
        for (Region1D region : regions) {
            if (region.totalPixels() != length) {
                throw new ShapeMismatchException(
                    "Cannot stack region " + region + " onto patches of length " + length);
            }
            for (int i = 0; i < length; i++) {
                if (!line.isMasked(region.x0() + i)) {
                    sums[i] += line.get(region.x0() + i);
                    counts[i]++;
                }
            }
        }
        boolean[] mask = new boolean[length];
        for (int i = 0; i < length; i++) {
            if (counts[i] == 0) {
                mask[i] = true;
                sums[i] = 0.0;
            } else {
                sums[i] /= counts[i];
            }
        }
        return Array1D.of(sums, mask, line.getPixelScale());
    }

    /**
     * @return Per derived region, the statistic of its unmasked pixels.
     */
    public double[] statisticListFrom(Array1D line, ExtractionWindow window, Statistic statistic) {
        List<Array1D> patches = patchListFrom(line, window);
        double[] result = new double[patches.size()];
        for (int p = 0; p < patches.size(); p++) {
            Array1D patch = patches.get(p);
            DoubleArrayList pool = new DoubleArrayList(patch.length());
            for (int i = 0; i < patch.length(); i++) {
                if (!patch.isMasked(i)) {
                    pool.add(patch.get(i));
                }
            }
            result[p] = statistic.of(pool);
        }
        return result;
    }

    /**
     * Adds the patches of {@code line} into {@code accumulator} at the derived regions.
     *
     * @throws IllegalArgumentException if {@code accumulator} is {@code line}.
     */
    public void scatterInto(Array1D accumulator, Array1D line, ExtractionWindow window) {
        if (accumulator == line) {
            throw new IllegalArgumentException("The accumulator must not be the source line");
        }
        requireLayoutLength(line, "Line");
        requireLayoutLength(accumulator, "Accumulator");
        for (Region1D region : regionListFrom(window)) {
            accumulator.addPatch(region, line.slice(region));
        }
    }

    public Array1D scatteredFrom(Array1D line, ExtractionWindow window) {
        Array1D accumulator = Array1D.zerosLike(line);
        scatterInto(accumulator, line, window);
        return accumulator;
    }

    /**
     * @return A copy of {@code line} with Gaussian noise added to every derived region, drawn in
     *         region order.
     */
    public Array1D addGaussianNoiseTo(Array1D line, ExtractionWindow window, double sigma, IRandomProvider random) {
        if (sigma < 0.0 || Double.isNaN(sigma)) {
            throw new IllegalArgumentException("Noise sigma must be non-negative, got " + sigma);
        }
        Objects.requireNonNull(random, "random");
        requireLayoutLength(line, "Line");
        Array1D noisy = line.copy();
        for (Region1D region : regionListFrom(window)) {
            for (int i = region.x0(); i < region.x1(); i++) {
                noisy.addAt(i, sigma * random.nextGaussian());
            }
        }
        return noisy;
    }

    private void requireLayoutLength(Array1D line, String what) {
        line.requireLength(layout.getLength(), what);
    }
}
