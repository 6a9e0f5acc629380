package org.avl.loft;

import org.locationtech.jts.geom.Coordinate;

import java.util.ArrayList;
import java.util.List;

public class SurfaceSpec {
    String     name;
    double     angleDeg  = 0.0;
    Coordinate scale     = new Coordinate(1.0, 1.0, 1.0);   // SCALE sx sy sz
    Coordinate translate = new Coordinate(0.0, 0.0, 0.0);   // TRANSLATE tx ty tz
    Double     yDuplicate;                                 // null = sin YDUPLICATE
    final List<SectionSpec> sections = new ArrayList<>();  // orden del archivo = orden en envergadura

    SurfaceSpec(String name) {
        this.name = name;
    }

    public String name() { return name; }
    public double angleDeg() { return angleDeg; }
    public Coordinate scale() { return scale; }
    public Coordinate translate() { return translate; }
    public Double yDuplicate() { return yDuplicate; }
    public List<SectionSpec> sections() { return sections; }

    // última sección abierta, o null si la superficie aún no tiene secciones
    SectionSpec lastSection() {
        return sections.isEmpty() ? null : sections.get(sections.size() - 1);
    }
}
