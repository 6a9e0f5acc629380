package org.avl.loft;

/**
 * Orientación de una superficie según el eje en que crece la envergadura.
 * La cuerda siempre va en X.
 */
public enum SurfaceOrientation {
    /** ala / estabilizador: envergadura en Y, perfil en el plano XZ */
    HORIZONTAL('Y', 'Z'),
    /** deriva: envergadura en Z, perfil en el plano XY */
    VERTICAL('Z', 'Y');

    private final char spanAxis;
    private final char normalAxis;

    SurfaceOrientation(char spanAxis, char normalAxis) {
        this.spanAxis = spanAxis;
        this.normalAxis = normalAxis;
    }

    public char spanAxis() { return spanAxis; }
    public char normalAxis() { return normalAxis; }
}
