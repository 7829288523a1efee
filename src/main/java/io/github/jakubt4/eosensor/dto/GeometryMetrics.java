package io.github.jakubt4.eosensor.dto;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ground geometry and pointing-error budget for one pointing case.
 *
 * <p>Pixel sizes, edge changes and errors are in meters, footprints in kilometers,
 * the Earth-center angle in degrees.
 */
public record GeometryMetrics(double offNadirAngle,
                              double centerPixelSize,
                              double edgePixelSize,
                              double horizontalFootprint,
                              double verticalFootprint,
                              double earthCenterAngle,
                              double rollEdgeChange,
                              double pitchEdgeChange,
                              double yawEdgeChange,
                              double gpsError,
                              double rssError) {

    /**
     * Named view of the metrics, in a stable order.
     */
    public Map<String, Double> asMap() {
        final var map = new LinkedHashMap<String, Double>();
        map.put("offNadirAngle", offNadirAngle);
        map.put("centerPixelSize", centerPixelSize);
        map.put("edgePixelSize", edgePixelSize);
        map.put("horizontalFootprint", horizontalFootprint);
        map.put("verticalFootprint", verticalFootprint);
        map.put("earthCenterAngle", earthCenterAngle);
        map.put("rollEdgeChange", rollEdgeChange);
        map.put("pitchEdgeChange", pitchEdgeChange);
        map.put("yawEdgeChange", yawEdgeChange);
        map.put("gpsError", gpsError);
        map.put("rssError", rssError);
        return Collections.unmodifiableMap(map);
    }
}
