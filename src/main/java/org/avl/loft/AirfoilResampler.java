package org.avl.loft;

import org.locationtech.jts.algorithm.Area;
import org.locationtech.jts.geom.Coordinate;

import java.util.Arrays;

public class AirfoilResampler {

    // área por debajo de la cual el perfil se considera degenerado (placa plana) y no tiene sentido de giro
    static final double MIN_ORIENTATION_AREA = 1e-9;

    /**
     * Re-muestrea {@code target} para que tenga tantos puntos como {@code reference}.
     * El punto k se interpola linealmente (x e y por separado) en la posición normalizada k/(N-1)
     * del índice del perfil destino. Supone que ambos perfiles empiezan y terminan en los mismos
     * puntos y se recorren en el mismo sentido; si no, solo se avisa.
     */
    public static AirfoilProfile resampleToReference(AirfoilProfile reference, AirfoilProfile target, RunLogger log) {
        Coordinate[] ref = reference.points;
        Coordinate[] pts = target.points;
        if (ref.length == 0 || pts.length == 0) {
            throw new IllegalArgumentException("No se puede re-muestrear un perfil vacío ("
                    + reference.name + " / " + target.name + ")");
        }

        if (log != null) {
            if (ref.length != pts.length) {
                log.warn("perfil %s tiene %d puntos, se re-muestrea a los %d de %s",
                        target.name, pts.length, ref.length, reference.name);
            }
            if (oppositeTraversal(ref, pts)) {
                log.warn("perfil %s se recorre en sentido contrario a %s; el loft puede quedar torcido",
                        target.name, reference.name);
            }
        }

        return new AirfoilProfile(target.name, resample(pts, ref.length));
    }

    // interpolación lineal sobre el dominio de índice normalizado [0,1]
    static Coordinate[] resample(Coordinate[] pts, int n) {
        Coordinate[] out = new Coordinate[n];
        int m = pts.length;
        for (int k = 0; k < n; k++) {
            if (m == 1) {
                out[k] = new Coordinate(pts[0].x, pts[0].y);
                continue;
            }
            double t = (n == 1) ? 0.0 : (double) k / (n - 1);
            double pos = t * (m - 1);
            int j = (int) Math.floor(pos);
            if (j >= m - 1) {
                out[k] = new Coordinate(pts[m - 1].x, pts[m - 1].y);
                continue;
            }
            double f = pos - j;
            Coordinate a = pts[j], b = pts[j + 1];
            out[k] = new Coordinate(a.x + f * (b.x - a.x), a.y + f * (b.y - a.y));
        }
        return out;
    }

    static boolean oppositeTraversal(Coordinate[] a, Coordinate[] b) {
        double sa = signedArea(a), sb = signedArea(b);
        if (Math.abs(sa) < MIN_ORIENTATION_AREA || Math.abs(sb) < MIN_ORIENTATION_AREA) return false;
        return Math.signum(sa) != Math.signum(sb);
    }

    // área con signo del anillo (positiva en sentido horario, convención de JTS)
    static double signedArea(Coordinate[] pts) {
        if (pts.length < 3) return 0.0;
        Coordinate[] ring = pts;
        if (!pts[0].equals2D(pts[pts.length - 1])) {
            ring = Arrays.copyOf(pts, pts.length + 1);
            ring[pts.length] = pts[0];
        }
        return Area.ofRingSigned(ring);
    }
}
