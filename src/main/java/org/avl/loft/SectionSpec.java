package org.avl.loft;

import org.locationtech.jts.geom.Coordinate;

public class SectionSpec {
    Coordinate leadingEdge;       // Xle Yle Zle
    double     chord;
    double     aincDeg = 0.0;     // incidencia local, se suma al ANGLE de la superficie
    String     airfoilFile;       // AFIL (null = hereda el perfil de referencia)
    String     nacaCode;          // NACA xxxx (null = no indicado)

    SectionSpec(Coordinate leadingEdge, double chord, double aincDeg) {
        this.leadingEdge = leadingEdge;
        this.chord = chord;
        this.aincDeg = aincDeg;
    }

    public Coordinate leadingEdge() { return leadingEdge; }
    public double chord() { return chord; }
    public double aincDeg() { return aincDeg; }
    public String airfoilFile() { return airfoilFile; }
    public String nacaCode() { return nacaCode; }

    // true si la sección nombra su propio perfil (AFIL o NACA)
    boolean hasOwnAirfoil() {
        return airfoilFile != null || nacaCode != null;
    }
}
