package org.ctiextract.extract;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.ctiextract.grid.Array1D;
import org.ctiextract.grid.Array2D;
import org.ctiextract.grid.ShapeMismatchException;
import org.ctiextract.grid.Statistic;
import org.ctiextract.random.IRandomProvider;
import org.ctiextract.region.ClockingAxis;
import org.ctiextract.region.EdgeAnchor;
import org.ctiextract.region.EmptyRegionListException;
import org.ctiextract.region.ExtractionWindow;
import org.ctiextract.region.Layout1D;
import org.ctiextract.region.Layout2D;
import org.ctiextract.region.Region1D;
import org.ctiextract.region.Region2D;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;

/**
 * Extracts the regions of one {@link ExtractorKind2D} from frames of one {@link Layout2D}.
 * <p>
 * Every operation first derives the region list for the given window (see
 * {@link #regionListFrom(ExtractionWindow)}) and then works on the pixels of those regions. Grids
 * passed in must have the layout's shape. Apart from {@link #scatterInto(Array2D, Array2D, ExtractionWindow)},
 * which adds into its accumulator, no operation modifies its arguments.
 */
public class Extractor2D {

    private static final Logger LOG = LoggerFactory.getLogger(Extractor2D.class);

    private static final Comparator<Region2D> CANONICAL_ORDER = Comparator
        .comparingInt(Region2D::y0)
        .thenComparingInt(Region2D::y1)
        .thenComparingInt(Region2D::x0)
        .thenComparingInt(Region2D::x1);

    private final ExtractorKind2D kind;
    private final Layout2D layout;

    public Extractor2D(ExtractorKind2D kind, Layout2D layout) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.layout = Objects.requireNonNull(layout, "layout");
    }

    public ExtractorKind2D getKind() {
        return kind;
    }

    public Layout2D getLayout() {
        return layout;
    }

    // ==================== Regions ====================

    /**
     * Applies the window to every parent structure of this kind.
     *
     * @param window The extraction window.
     * @return One region per parent structure, in layout order.
     * @throws org.ctiextract.region.InvalidRegionException if a derived region is degenerate,
     *         has a negative coordinate or lies outside the frame.
     */
    public List<Region2D> regionListFrom(ExtractionWindow window) {
        final ClockingAxis axis = kind.getAxis();
        final List<Region2D> parents = kind.parentRegionsFrom(layout);
        final List<Region2D> derived = new ArrayList<>(parents.size());
        for (Region2D parent : parents) {
            Region2D region = kind.getAnchor() == EdgeAnchor.LEADING
                ? parent.leadingRegionFrom(axis, window)
                : parent.trailingRegionFrom(axis, window, layout.trailingSpace(parent, axis));
            region.checkWithin(layout.getRows(), layout.getColumns());
            derived.add(region);
        }
        LOG.debug("{} derived {} regions for {}: {}", kind, derived.size(), window, derived);
        return Collections.unmodifiableList(derived);
    }

    /**
     * @param window The extraction window.
     * @param invert Flag every pixel outside the derived regions instead.
     * @return Flags of the frame shape, indexed {@code [row][column]}.
     */
    public boolean[][] maskFrom(ExtractionWindow window, boolean invert) {
        boolean[][] mask = new boolean[layout.getRows()][layout.getColumns()];
        for (Region2D region : regionListFrom(window)) {
            for (int r = region.y0(); r < region.y1(); r++) {
                for (int c = region.x0(); c < region.x1(); c++) {
                    mask[r][c] = true;
                }
            }
        }
        if (invert) {
            for (boolean[] row : mask) {
                for (int c = 0; c < row.length; c++) {
                    row[c] = !row[c];
                }
            }
        }
        return mask;
    }

    // ==================== Patches ====================

    /**
     * @param grid A frame of the layout's shape.
     * @param window The extraction window.
     * @return The values and mask of every derived region, in layout order.
     */
    public List<Array2D> patchListFrom(Array2D grid, ExtractionWindow window) {
        requireLayoutShape(grid, "Grid");
        List<Array2D> patches = new ArrayList<>();
        for (Region2D region : regionListFrom(window)) {
            patches.add(grid.slice(region));
        }
        return patches;
    }

    /**
     * Mask-aware mean of all patches. A cell masked in some patches is the mean of the others; a
     * cell masked in every patch is masked in the result, with value 0. The result does not depend
     * on the order of the region list.
     *
     * @param grid A frame of the layout's shape.
     * @param window The extraction window.
     * @return The stacked patch.
     * @throws EmptyRegionListException if no region is derived.
     * @throws ShapeMismatchException if the derived regions differ in shape.
     */
    public Array2D stackedFrom(Array2D grid, ExtractionWindow window) {
        Stack stack = stack(grid, window, "stackedFrom");
        BitSet mask = new BitSet(stack.counts.length);
        double[] means = new double[stack.counts.length];
        for (int i = 0; i < means.length; i++) {
            if (stack.counts[i] == 0) {
                mask.set(i);
            } else {
                means[i] = stack.sums[i] / stack.counts[i];
            }
        }
        return Array2D.fromFlat(stack.rows, stack.columns, means, mask, grid.getPixelScales());
    }

    /**
     * @param grid A frame of the layout's shape.
     * @param window The extraction window.
     * @return Per stacked cell, the number of unmasked contributing pixels.
     * @throws EmptyRegionListException if no region is derived.
     */
    public int[][] stackedTotalPixelsFrom(Array2D grid, ExtractionWindow window) {
        Stack stack = stack(grid, window, "stackedTotalPixelsFrom");
        int[][] totals = new int[stack.rows][stack.columns];
        for (int r = 0; r < stack.rows; r++) {
            System.arraycopy(stack.counts, r * stack.columns, totals[r], 0, stack.columns);
        }
        return totals;
    }

    /**
     * Collapses {@link #stackedFrom} across the axis orthogonal to this kind's axis, ignoring masked
     * stacked cells. A line with no unmasked cell is masked, with value 0.
     *
     * @param grid A frame of the layout's shape.
     * @param window The extraction window.
     * @return Profile along this kind's axis.
     * @throws EmptyRegionListException if no region is derived.
     */
    public Array1D binnedFrom(Array2D grid, ExtractionWindow window) {
        Array2D stacked = stackedFrom(grid, window);
        boolean parallel = kind.getAxis() == ClockingAxis.PARALLEL;
        int lines = parallel ? stacked.getRows() : stacked.getColumns();
        int across = parallel ? stacked.getColumns() : stacked.getRows();
        double[] values = new double[lines];
        boolean[] mask = new boolean[lines];
        for (int i = 0; i < lines; i++) {
            double sum = 0.0;
            int count = 0;
            for (int j = 0; j < across; j++) {
                int r = parallel ? i : j;
                int c = parallel ? j : i;
                if (!stacked.isMasked(r, c)) {
                    sum += stacked.get(r, c);
                    count++;
                }
            }
            if (count == 0) {
                mask[i] = true;
            } else {
                values[i] = sum / count;
            }
        }
        double scale = parallel ? grid.getPixelScales().y() : grid.getPixelScales().x();
        return Array1D.of(values, mask, scale);
    }

    /**
     * @param grid A frame of the layout's shape.
     * @param window The extraction window.
     * @return Per binned pixel, the number of unmasked pixels across all patches that fed it.
     * @throws EmptyRegionListException if no region is derived.
     */
    public int[] binnedTotalPixelsFrom(Array2D grid, ExtractionWindow window) {
        Stack stack = stack(grid, window, "binnedTotalPixelsFrom");
        boolean parallel = kind.getAxis() == ClockingAxis.PARALLEL;
        int[] totals = new int[parallel ? stack.rows : stack.columns];
        for (int r = 0; r < stack.rows; r++) {
            for (int c = 0; c < stack.columns; c++) {
                totals[parallel ? r : c] += stack.counts[r * stack.columns + c];
            }
        }
        return totals;
    }

    private Stack stack(Array2D grid, ExtractionWindow window, String operation) {
        requireLayoutShape(grid, "Grid");
        List<Region2D> regions = new ArrayList<>(regionListFrom(window));
        if (regions.isEmpty()) {
            throw new EmptyRegionListException(operation + " needs at least one region, " + kind + " derived none");
        }
        regions.sort(CANONICAL_ORDER);
        int rows = regions.get(0).totalRows();
        int columns = regions.get(0).totalColumns();
        double[] sums = new double[rows * columns];
        int[] counts = new int[rows * columns];
        for (Region2D region : regions) {
            if (region.totalRows() != rows || region.totalColumns() != columns) {
                throw new ShapeMismatchException("Cannot stack region " + region + " onto patches of shape ("
                    + rows + ", " + columns + ")");
            }
            for (int r = 0; r < rows; r++) {
                for (int c = 0; c < columns; c++) {
                    if (!grid.isMasked(region.y0() + r, region.x0() + c)) {
                        sums[r * columns + c] += grid.get(region.y0() + r, region.x0() + c);
                        counts[r * columns + c]++;
                    }
                }
            }
        }
        return new Stack(rows, columns, sums, counts);
    }

    private record Stack(int rows, int columns, double[] sums, int[] counts) {
    }

    // ==================== Statistics ====================

    /**
     * @param grid A frame of the layout's shape.
     * @param window The extraction window.
     * @param statistic The reduction.
     * @return Per derived region, the statistic of its unmasked pixels ({@code NaN} if all are masked).
     */
    public double[] statisticListFrom(Array2D grid, ExtractionWindow window, Statistic statistic) {
        List<Array2D> patches = patchListFrom(grid, window);
        double[] result = new double[patches.size()];
        for (int i = 0; i < patches.size(); i++) {
            Array2D patch = patches.get(i);
            DoubleArrayList pool = new DoubleArrayList(patch.getRows() * patch.getColumns());
            for (int r = 0; r < patch.getRows(); r++) {
                for (int c = 0; c < patch.getColumns(); c++) {
                    if (!patch.isMasked(r, c)) {
                        pool.add(patch.get(r, c));
                    }
                }
            }
            result[i] = statistic.of(pool);
        }
        return result;
    }

    /**
     * Pools the unmasked pixels of every patch per line across this kind's axis (per column for
     * parallel kinds, per row for serial kinds) and reduces each pool.
     *
     * @param grid A frame of the layout's shape.
     * @param window The extraction window.
     * @param statistic The reduction.
     * @return One value per line.
     * @throws EmptyRegionListException if no region is derived.
     * @throws ShapeMismatchException if the patches differ in their number of lines.
     */
    public double[] statisticListPerLineFrom(Array2D grid, ExtractionWindow window, Statistic statistic) {
        List<Array2D> patches = patchListFrom(grid, window);
        if (patches.isEmpty()) {
            throw new EmptyRegionListException("statisticListPerLineFrom needs at least one region, "
                + kind + " derived none");
        }
        int lines = lineCount(patches.get(0));
        List<DoubleArrayList> pools = new ArrayList<>(lines);
        for (int j = 0; j < lines; j++) {
            pools.add(new DoubleArrayList());
        }
        for (Array2D patch : patches) {
            if (lineCount(patch) != lines) {
                throw new ShapeMismatchException(
                    "Patch has " + lineCount(patch) + " lines, expected " + lines);
            }
            poolLines(patch, pools);
        }
        return reduce(pools, statistic);
    }

    /**
     * Like {@link #statisticListPerLineFrom}, but pooled separately per derived region.
     *
     * @return One per-line array per derived region, in layout order.
     */
    public List<double[]> statisticListsPerRegionFrom(Array2D grid, ExtractionWindow window, Statistic statistic) {
        List<double[]> result = new ArrayList<>();
        for (Array2D patch : patchListFrom(grid, window)) {
            int lines = lineCount(patch);
            List<DoubleArrayList> pools = new ArrayList<>(lines);
            for (int j = 0; j < lines; j++) {
                pools.add(new DoubleArrayList());
            }
            poolLines(patch, pools);
            result.add(reduce(pools, statistic));
        }
        return result;
    }

    private int lineCount(Array2D patch) {
        return kind.getAxis() == ClockingAxis.PARALLEL ? patch.getColumns() : patch.getRows();
    }

    private void poolLines(Array2D patch, List<DoubleArrayList> pools) {
        boolean parallel = kind.getAxis() == ClockingAxis.PARALLEL;
        for (int r = 0; r < patch.getRows(); r++) {
            for (int c = 0; c < patch.getColumns(); c++) {
                if (!patch.isMasked(r, c)) {
                    pools.get(parallel ? c : r).add(patch.get(r, c));
                }
            }
        }
    }

    private static double[] reduce(List<DoubleArrayList> pools, Statistic statistic) {
        double[] result = new double[pools.size()];
        for (int j = 0; j < result.length; j++) {
            result[j] = statistic.of(pools.get(j));
        }
        return result;
    }

    // ==================== Reconstruction ====================

    /**
     * Adds the patches of {@code grid} into {@code accumulator} at the derived regions. Pixels of
     * overlapping regions are added once per region. Masks are ignored.
     *
     * @param accumulator Grid of the layout's shape, modified in place.
     * @param grid A frame of the layout's shape.
     * @param window The extraction window.
     * @throws IllegalArgumentException if {@code accumulator} is {@code grid}.
     * @throws ShapeMismatchException if either grid does not have the layout's shape.
     */
    public void scatterInto(Array2D accumulator, Array2D grid, ExtractionWindow window) {
        if (accumulator == grid) {
            throw new IllegalArgumentException("The accumulator must not be the source grid");
        }
        requireLayoutShape(grid, "Grid");
        requireLayoutShape(accumulator, "Accumulator");
        for (Region2D region : regionListFrom(window)) {
            accumulator.addPatch(region, grid.slice(region));
        }
    }

    /**
     * @param grid A frame of the layout's shape.
     * @param window The extraction window.
     * @return A zero frame with the patches of {@code grid} scattered into it.
     */
    public Array2D scatteredFrom(Array2D grid, ExtractionWindow window) {
        Array2D accumulator = Array2D.zerosLike(grid);
        scatterInto(accumulator, grid, window);
        return accumulator;
    }

    /**
     * Adds Gaussian noise to the pixels of every derived region. Draws are taken region by region in
     * layout order, row-major within a region, so the result is reproducible for a seeded provider.
     *
     * @param grid A frame of the layout's shape.
     * @param window The extraction window.
     * @param sigma Standard deviation of the noise, non-negative.
     * @param random Source of the noise.
     * @return A noisy copy of {@code grid}.
     */
    public Array2D addGaussianNoiseTo(Array2D grid, ExtractionWindow window, double sigma, IRandomProvider random) {
        if (sigma < 0.0 || Double.isNaN(sigma)) {
            throw new IllegalArgumentException("Noise sigma must be non-negative, got " + sigma);
        }
        Objects.requireNonNull(random, "random");
        requireLayoutShape(grid, "Grid");
        Array2D noisy = grid.copy();
        for (Region2D region : regionListFrom(window)) {
            for (int r = region.y0(); r < region.y1(); r++) {
                for (int c = region.x0(); c < region.x1(); c++) {
                    noisy.addAt(r, c, sigma * random.nextGaussian());
                }
            }
        }
        return noisy;
    }

    // ==================== 1D datasets ====================

    /**
     * @param window The extraction window.
     * @return The charge-injected part of the profile {@link #binnedFrom} produces, if any.
     */
    public Optional<Region1D> binnedRegion1DFrom(ExtractionWindow window) {
        if (!kind.isChargeInjected()) {
            return BinnedRegions.eperRegionFrom(window);
        }
        int length;
        if (window.getForm() == ExtractionWindow.Form.PIXELS) {
            length = window.getEnd() - window.getStart();
        } else {
            List<Region2D> regions = regionListFrom(window);
            if (regions.isEmpty()) {
                throw new EmptyRegionListException("binnedRegion1DFrom needs at least one region");
            }
            length = regions.get(0).size(kind.getAxis());
        }
        return BinnedRegions.fprRegionFrom(window, length);
    }

    /**
     * Bins a 2D dataset into a 1D one. The noise map is binned like the data and divided by the
     * square root of the number of pixels that fed each binned pixel.
     *
     * @param data The frame.
     * @param noiseMap Its noise map.
     * @param preCtiData The frame before charge transfer.
     * @param window The extraction window.
     * @return The binned dataset with a layout marking the injected pixels.
     */
    public Dataset1D dataset1DFrom(Array2D data, Array2D noiseMap, Array2D preCtiData, ExtractionWindow window) {
        Array1D binnedData = binnedFrom(data, window);
        Array1D binnedNoise = binnedFrom(noiseMap, window);
        int[] totalPixels = binnedTotalPixelsFrom(noiseMap, window);
        double[] noise = binnedNoise.toArray();
        for (int i = 0; i < noise.length; i++) {
            noise[i] = totalPixels[i] > 0 ? noise[i] / Math.sqrt(totalPixels[i]) : 0.0;
        }
        Array1D scaledNoise = Array1D.of(noise, binnedNoise.toMaskArray(), binnedNoise.getPixelScale());
        Array1D binnedPreCti = binnedFrom(preCtiData, window);
        List<Region1D> injected = binnedRegion1DFrom(window).map(List::of).orElse(List.of());
        Layout1D layout1D = Layout1D.of(binnedData.length(), injected);
        LOG.debug("{} binned a dataset into {} pixels, injected region {}", kind, binnedData.length(), injected);
        return new Dataset1D(binnedData, scaledNoise, binnedPreCti, layout1D);
    }

    private void requireLayoutShape(Array2D grid, String what) {
        grid.requireShape(layout.getRows(), layout.getColumns(), what);
    }

    @Override
    public String toString() {
        return "Extractor2D{" + kind + ", " + layout + "}";
    }
}
