package org.avl.loft;

import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class OrientationDetectorTest {

    static SectionSpec at(double y, double z) {
        return new SectionSpec(new Coordinate(0, y, z), 1.0, 0.0);
    }

    @Test
    void detect_wingSpreadInYIsHorizontal() {
        assertThat(OrientationDetector.detect(List.of(at(0, 0), at(3, 0.2), at(5, 0.5))))
                .isEqualTo(SurfaceOrientation.HORIZONTAL);
    }

    @Test
    void detect_finSpreadInZIsVertical() {
        assertThat(OrientationDetector.detect(List.of(at(0, 0), at(0.1, 1.5))))
                .isEqualTo(SurfaceOrientation.VERTICAL);
    }

    @Test
    void detect_tieResolvesToHorizontal() {
        assertThat(OrientationDetector.detect(List.of(at(0, 0), at(1, 1))))
                .isEqualTo(SurfaceOrientation.HORIZONTAL);
        assertThat(OrientationDetector.detect(List.of(at(2, 2), at(2, 2))))
                .isEqualTo(SurfaceOrientation.HORIZONTAL);
    }

    @Test
    void detect_usesRangeNotPosition() {
        // Y grande pero constante, Z varía poco: sigue siendo vertical
        assertThat(OrientationDetector.detect(List.of(at(10, 0), at(10, 0.3), at(10, 0.1))))
                .isEqualTo(SurfaceOrientation.VERTICAL);
    }

    @Test
    void isLoftable_requiresTwoSections() {
        SurfaceSpec s = new SurfaceSpec("Tab");
        s.sections.add(at(0, 0));
        assertThat(OrientationDetector.isLoftable(s)).isFalse();

        s.sections.add(at(1, 0));
        assertThat(OrientationDetector.isLoftable(s)).isTrue();
    }

    @Test
    void orientation_axes() {
        assertThat(SurfaceOrientation.HORIZONTAL.spanAxis()).isEqualTo('Y');
        assertThat(SurfaceOrientation.HORIZONTAL.normalAxis()).isEqualTo('Z');
        assertThat(SurfaceOrientation.VERTICAL.spanAxis()).isEqualTo('Z');
        assertThat(SurfaceOrientation.VERTICAL.normalAxis()).isEqualTo('Y');
    }
}
