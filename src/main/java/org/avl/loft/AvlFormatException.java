package org.avl.loft;

/**
 * Error de formato en un archivo AVL: bloque numérico mal formado, línea de datos faltante,
 * AFIL sin SECTION previa, etc. Aborta la conversión.
 */
public class AvlFormatException extends IllegalArgumentException {

    private final int lineNumber;

    public AvlFormatException(String message, int lineIndex) {
        super(message + " (línea " + (lineIndex + 1) + ")");
        this.lineNumber = lineIndex + 1;
    }

    public AvlFormatException(String message, int lineIndex, Throwable cause) {
        super(message + " (línea " + (lineIndex + 1) + ")", cause);
        this.lineNumber = lineIndex + 1;
    }

    /** Número de línea (base 1) del constructo que falló. */
    public int getLineNumber() {
        return lineNumber;
    }
}
