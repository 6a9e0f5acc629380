package org.avl.loft;

import org.locationtech.jts.geom.Coordinate;

import java.util.List;
import java.util.Locale;

/**
 * Exporta los perfiles a OpenSCAD: cada par de secciones consecutivas es un polyhedron
 * (caras laterales + dos tapas) y las superficies con YDUPLICATE se repiten espejadas.
 */
class ScadWriter {

    static final double CLOSE_TOL = 1e-9;

    static String toScad(List<SurfaceProfiles> surfaces) {
        StringBuilder sb = new StringBuilder();
        sb.append("// generado por avl-loft\n");
        sb.append("union() {\n");
        for (SurfaceProfiles s : surfaces) {
            sb.append("  // Surface: ").append(s.name).append("\n");
            sb.append("  union() {\n");
            appendSegments(sb, s.profiles, "    ");

            // copia espejada a nivel de sólido
            if (s.yDuplicate != null) {
                double y0 = s.yDuplicate;
                sb.append("    translate([0, ").append(fmt(y0)).append(", 0])\n");
                sb.append("      mirror([0, 1, 0])\n");
                sb.append("        translate([0, ").append(fmt(-y0)).append(", 0]) {\n");
                appendSegments(sb, s.profiles, "          ");
                sb.append("        }\n");
            }
            sb.append("  }\n");
        }
        sb.append("}\n");
        return sb.toString();
    }

    // un polyhedron por cada par de perfiles adyacentes (el loft empareja secciones vecinas)
    static void appendSegments(StringBuilder sb, List<PositionedProfile> profiles, String indent) {
        for (int i = 0; i + 1 < profiles.size(); i++) {
            appendPolyhedron(sb, profiles.get(i), profiles.get(i + 1), indent);
        }
    }

    static void appendPolyhedron(StringBuilder sb, PositionedProfile a, PositionedProfile b, String indent) {
        Coordinate[] pa = a.points, pb = b.points;
        if (pa.length != pb.length) {
            throw new IllegalArgumentException("Perfiles con distinta cantidad de puntos: "
                    + pa.length + " vs " + pb.length);
        }
        // si ambos están cerrados, el último punto repite al primero y no va en las caras
        int n = (isClosed(pa) && isClosed(pb)) ? pa.length - 1 : pa.length;
        if (n < 3) throw new IllegalArgumentException("Perfil con menos de 3 puntos distintos");

        sb.append(indent).append("polyhedron(\n");
        sb.append(indent).append("  points=[");
        for (int i = 0; i < n; i++) appendPoint(sb, pa[i], i == 0);
        for (int i = 0; i < n; i++) appendPoint(sb, pb[i], false);
        sb.append("],\n");

        sb.append(indent).append("  faces=[");
        // tapa inicial (invertida) y tapa final
        sb.append("[");
        for (int i = n - 1; i >= 0; i--) sb.append(i).append(i > 0 ? "," : "");
        sb.append("],[");
        for (int i = 0; i < n; i++) sb.append(n + i).append(i < n - 1 ? "," : "");
        sb.append("]");
        // caras laterales
        for (int i = 0; i < n; i++) {
            int j = (i + 1) % n;
            sb.append(",[").append(i).append(",").append(j).append(",")
              .append(n + j).append(",").append(n + i).append("]");
        }
        sb.append("]\n");
        sb.append(indent).append(");\n");
    }

    static void appendPoint(StringBuilder sb, Coordinate c, boolean first) {
        if (!first) sb.append(", ");
        sb.append("[").append(fmt(c.x)).append(", ").append(fmt(c.y)).append(", ").append(fmt(c.getZ())).append("]");
    }

    static boolean isClosed(Coordinate[] pts) {
        return pts.length > 1 && pts[0].distance3D(pts[pts.length - 1]) < CLOSE_TOL;
    }

    static String fmt(double d) {
        return String.format(Locale.US, "%.5f", d);
    }
}
