package org.ctiextract.orientation;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import org.ctiextract.region.ReadoutCorner;
import org.ctiextract.region.UnsupportedOrientationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigUtil;
import com.typesafe.config.ConfigValue;

/**
 * Reads quadrant readout corners from a HOCON block:
 * <pre>
 * readout-corners {
 *   E = [1, 0]
 *   F = [1, 1]
 *   G = TOP_RIGHT
 * }
 * </pre>
 * Each entry is either a {@code [row, column]} corner tuple or a {@link ReadoutCorner} name.
 */
public class ConfigReadoutCornerLookup implements IReadoutCornerLookup {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigReadoutCornerLookup.class);

    private final Map<String, ReadoutCorner> cornersByQuadrant;

    /**
     * @param config The "readout-corners" configuration block.
     * @throws UnsupportedOrientationException if an entry is not a valid corner.
     */
    public ConfigReadoutCornerLookup(Config config) {
        Map<String, ReadoutCorner> corners = new TreeMap<>();
        for (Map.Entry<String, ConfigValue> entry : config.root().entrySet()) {
            String quadrant = entry.getKey();
            corners.put(quadrant, parseCorner(config, quadrant));
        }
        this.cornersByQuadrant = Collections.unmodifiableMap(corners);
        LOG.debug("Loaded readout corners for {} quadrants", cornersByQuadrant.size());
    }

    private static ReadoutCorner parseCorner(Config config, String quadrant) {
        String path = ConfigUtil.joinPath(quadrant);
        try {
            return switch (config.getValue(path).valueType()) {
                case LIST -> {
                    List<Integer> tuple = config.getIntList(path);
                    if (tuple.size() != 2) {
                        throw new UnsupportedOrientationException(
                            "Readout corner of quadrant " + quadrant + " must be [row, column], got " + tuple);
                    }
                    yield ReadoutCorner.of(tuple.get(0), tuple.get(1));
                }
                case STRING -> ReadoutCorner.fromName(config.getString(path));
                default -> throw new UnsupportedOrientationException(
                    "Readout corner of quadrant " + quadrant + " must be a list or a name");
            };
        } catch (ConfigException e) {
            throw new UnsupportedOrientationException("Invalid readout corner for quadrant " + quadrant, e);
        }
    }

    @Override
    public ReadoutCorner cornerFor(String quadrantId) {
        ReadoutCorner corner = cornersByQuadrant.get(quadrantId);
        if (corner == null) {
            throw new UnsupportedOrientationException("No readout corner configured for quadrant " + quadrantId);
        }
        return corner;
    }

    /**
     * @return The configured quadrant identifiers, sorted.
     */
    public Set<String> quadrants() {
        return cornersByQuadrant.keySet();
    }
}
