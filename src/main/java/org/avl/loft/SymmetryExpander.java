package org.avl.loft;

import org.locationtech.jts.geom.Coordinate;

import java.util.ArrayList;
import java.util.List;

public final class SymmetryExpander {

    private SymmetryExpander() {}

    // refleja un punto respecto del plano Y = y0
    public static Coordinate mirrorPoint(Coordinate c, double y0) {
        return new Coordinate(c.x, 2 * y0 - c.y, c.getZ());
    }

    // copia espejada de los perfiles, mismo orden; en superficies horizontales la envergadura es Y y también se refleja
    public static List<PositionedProfile> mirror(List<PositionedProfile> profiles, double y0, SurfaceOrientation orientation) {
        List<PositionedProfile> out = new ArrayList<>(profiles.size());
        for (PositionedProfile p : profiles) {
            Coordinate[] pts = new Coordinate[p.points.length];
            for (int i = 0; i < pts.length; i++) pts[i] = mirrorPoint(p.points[i], y0);
            double span = orientation == SurfaceOrientation.HORIZONTAL ? 2 * y0 - p.spanCoordinate : p.spanCoordinate;
            out.add(new PositionedProfile(span, pts, p.chord, p.sectionLeadingEdgeX));
        }
        return out;
    }
}
