package org.avl.loft;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.util.AffineTransformation;

import java.util.ArrayList;
import java.util.List;

/**
 * Posiciona el perfil de cada sección: escala por la cuerda, rotación por incidencia alrededor
 * del borde de fuga y traslación al borde de ataque de la sección (más el TRANSLATE de la
 * superficie). Todo se hace en el plano 2D (cuerda, normal) y al final se arma el punto 3D
 * según la orientación.
 */
public final class ProfileBuilder {

    private ProfileBuilder() {}

    // construye un perfil por sección, en el mismo orden que las secciones
    public static List<PositionedProfile> build(SurfaceSpec surface,
                                                List<AirfoilProfile> airfoils,
                                                SurfaceOrientation orientation) {
        if (airfoils.size() != surface.sections.size()) {
            throw new IllegalArgumentException("Se esperaban " + surface.sections.size()
                    + " perfiles para " + surface.name + " y llegaron " + airfoils.size());
        }
        List<PositionedProfile> out = new ArrayList<>(airfoils.size());
        for (int i = 0; i < airfoils.size(); i++) {
            out.add(buildSection(surface, surface.sections.get(i), airfoils.get(i), orientation));
        }
        return out;
    }

    public static PositionedProfile buildSection(SurfaceSpec surf, SectionSpec sec,
                                                 AirfoilProfile airfoil, SurfaceOrientation orientation) {
        int normal = ordinate(orientation.normalAxis());
        int span   = ordinate(orientation.spanAxis());

        // la forma del perfil usa solo el factor de escala en X, en ambos ejes
        double scaledChord = sec.chord * surf.scale.x;
        double inc = Math.toRadians(surf.angleDeg + sec.aincDeg);

        AffineTransformation at = sectionTransform(scaledChord, inc,
                sec.leadingEdge.x * surf.scale.x + surf.translate.x,
                sec.leadingEdge.getOrdinate(normal) * surf.scale.getOrdinate(normal) + surf.translate.getOrdinate(normal));

        double spanCoord = sec.leadingEdge.getOrdinate(span) * surf.scale.getOrdinate(span)
                + surf.translate.getOrdinate(span);

        Coordinate[] pts = new Coordinate[airfoil.points.length];
        Coordinate local = new Coordinate();
        for (int i = 0; i < pts.length; i++) {
            at.transform(airfoil.points[i], local);
            pts[i] = orientation == SurfaceOrientation.VERTICAL
                    ? new Coordinate(local.x, local.y, spanCoord)
                    : new Coordinate(local.x, spanCoord, local.y);
        }
        return new PositionedProfile(spanCoord, pts, scaledChord, sec.leadingEdge.x);
    }

    /**
     * escala(c) -> rotación alrededor del borde de fuga (c, 0) -> traslación (dx, dn).
     * Se rota en sentido horario: incidencia positiva levanta el borde de ataque (nariz arriba, como AVL).
     */
    static AffineTransformation sectionTransform(double scaledChord, double incRad, double dx, double dn) {
        AffineTransformation at = AffineTransformation.scaleInstance(scaledChord, scaledChord);
        if (incRad != 0.0) {
            at.compose(AffineTransformation.rotationInstance(-incRad, scaledChord, 0.0));
        }
        at.compose(AffineTransformation.translationInstance(dx, dn));
        return at;
    }

    static int ordinate(char axis) {
        switch (axis) {
            case 'X': return Coordinate.X;
            case 'Y': return Coordinate.Y;
            case 'Z': return Coordinate.Z;
            default: throw new IllegalArgumentException("Eje desconocido: " + axis);
        }
    }
}
