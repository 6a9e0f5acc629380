package org.avl.loft;

import org.locationtech.jts.geom.Coordinate;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public class AirfoilLoader {

    static final String DEFAULT_AIRFOIL_RESOURCE = "airfoils/naca0012.dat";
    static final int    FLAT_PLATE_POINTS        = 120;
    static final int    NACA_POINTS_PER_SIDE     = 65;

    // lee un archivo de perfil: un par "x z" por línea, las líneas que no parsean se saltan
    public static AirfoilProfile load(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new NoSuchFileException(path.toString(), null, "archivo de perfil no encontrado");
        }
        try (BufferedReader br = Files.newBufferedReader(path, StandardCharsets.ISO_8859_1)) {
            return new AirfoilProfile(path.getFileName().toString(), readPoints(br));
        }
    }

    static Coordinate[] readPoints(BufferedReader br) throws IOException {
        List<Coordinate> pts = new ArrayList<>();
        String line;
        while ((line = br.readLine()) != null) {
            Coordinate c = parsePair(line);
            if (c != null) pts.add(c);
        }
        return pts.toArray(new Coordinate[0]);
    }

    // devuelve null si la línea no empieza con dos números (cabecera, vacía, basura)
    static Coordinate parsePair(String line) {
        String[] t = AvlLineReader.tokens(line);
        if (t.length < 2) return null;
        try {
            return new Coordinate(Double.parseDouble(t[0]), Double.parseDouble(t[1]));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    // perfil por defecto (NACA 0012 incluido en el jar); si no está disponible, placa plana
    public static AirfoilProfile defaultAirfoil() {
        return defaultAirfoil(DEFAULT_AIRFOIL_RESOURCE);
    }

    static AirfoilProfile defaultAirfoil(String resource) {
        InputStream in = AirfoilLoader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) return flatPlate(FLAT_PLATE_POINTS);
        try (BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.ISO_8859_1))) {
            Coordinate[] pts = readPoints(br);
            if (pts.length < 3) return flatPlate(FLAT_PLATE_POINTS);
            return new AirfoilProfile("NACA 0012", pts);
        } catch (IOException e) {
            throw new UncheckedIOException("No se pudo leer " + resource, e);
        }
    }

    // placa plana: n/2 puntos de x=1 a x=0 y luego los mismos en sentido inverso (espesor cero)
    public static AirfoilProfile flatPlate(int n) {
        int half = n / 2;
        if (half < 2) throw new IllegalArgumentException("Placa plana requiere n >= 4");
        Coordinate[] pts = new Coordinate[half * 2];
        for (int i = 0; i < half; i++) {
            double x = 1.0 - (double) i / (half - 1);
            pts[i] = new Coordinate(x, 0.0);
            pts[pts.length - 1 - i] = new Coordinate(x, 0.0);
        }
        return new AirfoilProfile("placa plana", pts);
    }

    /**
     * Perfil NACA de 4 dígitos (mptt) con espaciado coseno y borde de fuga cerrado.
     * Orden Selig: borde de fuga, extradós, borde de ataque, intradós, borde de fuga.
     */
    public static AirfoilProfile naca4(String code, int pointsPerSide) {
        if (code == null || !code.matches("\\d{4}")) {
            throw new IllegalArgumentException("Designación NACA inválida: " + code);
        }
        if (pointsPerSide < 3) throw new IllegalArgumentException("pointsPerSide debe ser >= 3");
        double m = (code.charAt(0) - '0') / 100.0;
        double p = (code.charAt(1) - '0') / 10.0;
        double t = Integer.parseInt(code.substring(2)) / 100.0;

        int n = pointsPerSide;
        Coordinate[] upper = new Coordinate[n];
        Coordinate[] lower = new Coordinate[n];
        for (int i = 0; i < n; i++) {
            double x = 0.5 * (1.0 - Math.cos(Math.PI * i / (n - 1)));
            double yt = 5.0 * t * (0.2969 * Math.sqrt(x) - 0.1260 * x - 0.3516 * x * x
                    + 0.2843 * x * x * x - 0.1036 * x * x * x * x);
            double yc, dyc;
            if (m == 0.0 || p == 0.0) {
                yc = 0.0; dyc = 0.0;
            } else if (x < p) {
                yc  = m / (p * p) * (2 * p * x - x * x);
                dyc = 2 * m / (p * p) * (p - x);
            } else {
                yc  = m / ((1 - p) * (1 - p)) * ((1 - 2 * p) + 2 * p * x - x * x);
                dyc = 2 * m / ((1 - p) * (1 - p)) * (p - x);
            }
            double th = Math.atan(dyc);
            upper[i] = new Coordinate(x - yt * Math.sin(th), yc + yt * Math.cos(th));
            lower[i] = new Coordinate(x + yt * Math.sin(th), yc - yt * Math.cos(th));
        }

        Coordinate[] pts = new Coordinate[2 * n - 1];
        for (int i = 0; i < n; i++) pts[i] = upper[n - 1 - i];
        for (int i = 1; i < n; i++) pts[n - 1 + i] = lower[i];
        return new AirfoilProfile("NACA " + code, pts);
    }

    public static AirfoilProfile naca4(String code) {
        return naca4(code, NACA_POINTS_PER_SIDE);
    }
}
