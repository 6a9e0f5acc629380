package org.avl.loft;

import java.util.List;

/**
 * Lo que recibe el paso de lofting por cada superficie: perfiles en orden de envergadura y,
 * si corresponde, el plano de simetría a aplicar después de construir el sólido.
 */
public class SurfaceProfiles {
    final String                  name;
    final SurfaceOrientation      orientation;
    final List<PositionedProfile> profiles;
    final Double                  yDuplicate;

    SurfaceProfiles(String name, SurfaceOrientation orientation, List<PositionedProfile> profiles, Double yDuplicate) {
        this.name = name;
        this.orientation = orientation;
        this.profiles = List.copyOf(profiles);
        this.yDuplicate = yDuplicate;
    }

    public String name() { return name; }
    public SurfaceOrientation orientation() { return orientation; }
    public List<PositionedProfile> profiles() { return profiles; }
    public Double yDuplicate() { return yDuplicate; }

    // duplicación a nivel de perfiles: la copia espejada, o null si la superficie no tiene YDUPLICATE
    public SurfaceProfiles mirrored() {
        if (yDuplicate == null) return null;
        return new SurfaceProfiles(name + " (espejo)", orientation,
                SymmetryExpander.mirror(profiles, yDuplicate, orientation), null);
    }
}
