package org.avl.loft;

import org.locationtech.jts.geom.Coordinate;

/**
 * Perfil 2D normalizado a cuerda 1: {@code x} es la coordenada a lo largo de la cuerda y
 * {@code y} la normal al plano del perfil (la "z" del archivo de perfil).
 * El orden de recorrido es el del archivo de origen; no se reorienta.
 */
public class AirfoilProfile {
    final String       name;
    final Coordinate[] points;

    AirfoilProfile(String name, Coordinate[] points) {
        this.name = name;
        this.points = points;
    }

    public String name() { return name; }
    public Coordinate[] points() { return points; }
    public int size() { return points.length; }

    // primer y último punto coinciden
    boolean isClosed() {
        return points.length > 1 && points[0].equals2D(points[points.length - 1]);
    }
}
