package org.avl.loft;

import org.locationtech.jts.geom.Coordinate;

// perfil de una sección ya escalado, rotado y trasladado en 3D
public class PositionedProfile {
    final double       spanCoordinate;       // posición sobre el eje de envergadura
    final Coordinate[] points;               // puntos 3D (x, y, z)
    final double       chord;                // cuerda ya escalada
    final double       sectionLeadingEdgeX;  // Xle de la sección tal como viene en el AVL

    PositionedProfile(double spanCoordinate, Coordinate[] points, double chord, double sectionLeadingEdgeX) {
        this.spanCoordinate = spanCoordinate;
        this.points = points;
        this.chord = chord;
        this.sectionLeadingEdgeX = sectionLeadingEdgeX;
    }

    public double spanCoordinate() { return spanCoordinate; }
    public Coordinate[] points() { return points; }
    public double chord() { return chord; }
    public double sectionLeadingEdgeX() { return sectionLeadingEdgeX; }
}
