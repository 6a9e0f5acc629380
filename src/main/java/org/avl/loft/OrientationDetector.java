package org.avl.loft;

import java.util.List;

public final class OrientationDetector {

    private OrientationDetector() {}

    // una superficie con menos de 2 secciones no se puede loftear
    public static boolean isLoftable(SurfaceSpec surface) {
        return surface.sections.size() >= 2;
    }

    // VERTICAL si la dispersión en Z supera estrictamente a la de Y; empate -> HORIZONTAL
    public static SurfaceOrientation detect(List<SectionSpec> sections) {
        if (sections.isEmpty()) throw new IllegalArgumentException("Superficie sin secciones");
        double minY = Double.POSITIVE_INFINITY, maxY = Double.NEGATIVE_INFINITY;
        double minZ = Double.POSITIVE_INFINITY, maxZ = Double.NEGATIVE_INFINITY;
        for (SectionSpec s : sections) {
            minY = Math.min(minY, s.leadingEdge.y);
            maxY = Math.max(maxY, s.leadingEdge.y);
            minZ = Math.min(minZ, s.leadingEdge.getZ());
            maxZ = Math.max(maxZ, s.leadingEdge.getZ());
        }
        double yRange = maxY - minY;
        double zRange = maxZ - minZ;
        return zRange > yRange ? SurfaceOrientation.VERTICAL : SurfaceOrientation.HORIZONTAL;
    }
}
