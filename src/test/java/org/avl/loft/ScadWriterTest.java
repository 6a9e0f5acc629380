package org.avl.loft;

import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScadWriterTest {

    // triángulo cerrado (4 puntos, el último repite el primero) a la altura y
    static PositionedProfile triangle(double y) {
        return new PositionedProfile(y, new Coordinate[]{
                new Coordinate(1, y, 0), new Coordinate(0.5, y, 0.1), new Coordinate(0, y, 0), new Coordinate(1, y, 0)
        }, 1.0, 0.0);
    }

    static int count(String text, String needle) {
        int n = 0;
        for (int i = text.indexOf(needle); i >= 0; i = text.indexOf(needle, i + 1)) n++;
        return n;
    }

    @Test
    void toScad_emitsOnePolyhedronPerAdjacentPair() {
        SurfaceProfiles s = new SurfaceProfiles("Wing", SurfaceOrientation.HORIZONTAL,
                List.of(triangle(0), triangle(1), triangle(2)), null);

        String scad = ScadWriter.toScad(List.of(s));

        assertThat(count(scad, "polyhedron(")).isEqualTo(2);
        assertThat(scad).contains("// Surface: Wing").doesNotContain("mirror(");
        // el punto de cierre no se repite: 3 + 3 puntos por segmento
        assertThat(scad).contains("points=[[1.00000, 0.00000, 0.00000], [0.50000, 0.00000, 0.10000], [0.00000, 0.00000, 0.00000], [1.00000, 1.00000, 0.00000]");
        assertThat(scad).contains("faces=[[2,1,0],[3,4,5],[0,1,4,3],[1,2,5,4],[2,0,3,5]]");
    }

    @Test
    void toScad_yDuplicateAddsMirroredCopy() {
        SurfaceProfiles s = new SurfaceProfiles("Stab", SurfaceOrientation.HORIZONTAL,
                List.of(triangle(0), triangle(1)), 0.25);

        String scad = ScadWriter.toScad(List.of(s));

        assertThat(count(scad, "polyhedron(")).isEqualTo(2);
        assertThat(scad).contains("translate([0, 0.25000, 0])")
                .contains("mirror([0, 1, 0])")
                .contains("translate([0, -0.25000, 0])");
    }

    @Test
    void toScad_rejectsProfilesWithDifferentPointCounts() {
        PositionedProfile small = new PositionedProfile(1, new Coordinate[]{
                new Coordinate(1, 1, 0), new Coordinate(0, 1, 0.1), new Coordinate(0, 1, -0.1)}, 1, 0);
        SurfaceProfiles s = new SurfaceProfiles("X", SurfaceOrientation.HORIZONTAL, List.of(triangle(0), small), null);

        assertThatThrownBy(() -> ScadWriter.toScad(List.of(s)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("distinta cantidad");
    }
}
