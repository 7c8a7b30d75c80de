package org.ctiextract.config;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

import org.ctiextract.region.ExtractionWindow;
import org.ctiextract.region.InvalidRegionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigUtil;

/**
 * Extraction windows configured per extractor kind:
 * <pre>
 * windows {
 *   parallel-fpr = [0, 10]
 *   parallel-eper { pixels-from-end = 5 }
 *   serial-eper = full
 * }
 * </pre>
 * A list is a {@code [start, end]} pixel range, the string {@code full} selects the whole region
 * or trailing space, and an object with {@code pixels-from-end} selects the last pixels.
 */
public class WindowSettings {

    private static final Logger LOG = LoggerFactory.getLogger(WindowSettings.class);

    private static final String FULL = "full";

    private final Map<String, ExtractionWindow> windowsByKind;

    /**
     * @param config The "windows" configuration block.
     * @throws InvalidRegionException if an entry is malformed.
     */
    public WindowSettings(Config config) {
        Map<String, ExtractionWindow> windows = new TreeMap<>();
        for (String kind : config.root().keySet()) {
            windows.put(kind, parseWindow(kind, config, ConfigUtil.joinPath(kind)));
        }
        this.windowsByKind = Collections.unmodifiableMap(windows);
        LOG.debug("Loaded extraction windows: {}", windowsByKind);
    }

    /**
     * @param libraryConfig The {@code cti-extract} block.
     * @return Settings for its {@code windows} entry, empty if absent.
     */
    public static WindowSettings fromLibraryConfig(Config libraryConfig) {
        return libraryConfig.hasPath("windows")
            ? new WindowSettings(libraryConfig.getConfig("windows"))
            : new WindowSettings(ConfigFactory.empty());
    }

    static ExtractionWindow parseWindow(String kind, Config config, String path) {
        try {
            return switch (config.getValue(path).valueType()) {
                case LIST -> {
                    List<Integer> range = config.getIntList(path);
                    if (range.size() != 2) {
                        throw new InvalidRegionException(
                            "Window '" + kind + "' must be [start, end], got " + range);
                    }
                    yield ExtractionWindow.pixels(range.get(0), range.get(1));
                }
                case STRING -> {
                    String form = config.getString(path);
                    if (!FULL.equalsIgnoreCase(form)) {
                        throw new InvalidRegionException(
                            "Window '" + kind + "' must be a range, 'full' or { pixels-from-end = n }, got '" + form + "'");
                    }
                    yield ExtractionWindow.full();
                }
                case OBJECT -> ExtractionWindow.fromEnd(config.getConfig(path).getInt("pixels-from-end"));
                default -> throw new InvalidRegionException(
                    "Window '" + kind + "' must be a range, 'full' or { pixels-from-end = n }");
            };
        } catch (ConfigException e) {
            throw new InvalidRegionException("Malformed window '" + kind + "'", e);
        }
    }

    /**
     * @param kind The extractor kind key, e.g. {@code "parallel-eper"}.
     * @return The configured window, if any.
     */
    public Optional<ExtractionWindow> windowFor(String kind) {
        return Optional.ofNullable(windowsByKind.get(kind));
    }

    /**
     * @param kind The extractor kind key.
     * @return The configured window.
     * @throws InvalidRegionException if no window is configured for the kind.
     */
    public ExtractionWindow requireWindowFor(String kind) {
        return windowFor(kind).orElseThrow(
            () -> new InvalidRegionException("No extraction window configured for '" + kind + "'"));
    }

    public Set<String> kinds() {
        return windowsByKind.keySet();
    }
}
