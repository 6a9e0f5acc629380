package org.avl.loft;

import org.locationtech.jts.geom.Coordinate;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Parser tolerante del formato AVL. Solo interpreta las palabras clave necesarias para la
 * geometría (SURFACE, ANGLE, SCALE, TRANSLATE, YDUPLICATE, SECTION, AFIL, NACA); el resto
 * se ignora.
 */
public class AvlParser {

    // estado explícito del parseo: superficie en construcción y cursor de línea
    static final class ParserState {
        final List<String> lines;
        final List<SurfaceSpec> surfaces = new ArrayList<>();
        SurfaceSpec current;
        int i;

        ParserState(List<String> lines) {
            this.lines = lines;
        }

        String line() { return lines.get(i); }

        // índice de la siguiente línea útil después de la actual; error si no existe
        int nextDataLine(String construct) {
            int next = AvlLineReader.skipComments(lines, i + 1);
            if (next >= lines.size()) {
                throw new AvlFormatException(construct + " sin línea de datos", i);
            }
            return next;
        }
    }

    public static List<SurfaceSpec> parse(Path avlPath) throws IOException {
        return parse(AvlLineReader.readLines(avlPath));
    }

    public static List<SurfaceSpec> parse(List<String> lines) {
        ParserState st = new ParserState(lines);
        while (st.i < lines.size()) {
            String line = st.line();

            if (line.isEmpty() || AvlLineReader.isComment(line)) {
                st.i++;
                continue;
            }

            if (line.equals("SURFACE")) {
                int nameIdx = st.nextDataLine("SURFACE");
                st.current = new SurfaceSpec(lines.get(nameIdx));
                st.surfaces.add(st.current);
                st.i = nameIdx + 1;
                continue;
            }

            // un bloque BODY cierra la superficie: su TRANSLATE/SCALE no le pertenece
            if (line.equals("BODY")) {
                st.current = null;
                st.i++;
                continue;
            }

            // fuera de una superficie no hay nada que interpretar
            if (st.current != null) handleKeyword(st, line);

            st.i++;
        }
        return st.surfaces;
    }

    // procesa una línea dentro de la superficie actual; deja st.i en la última línea consumida
    static void handleKeyword(ParserState st, String line) {
        SurfaceSpec s = st.current;

        if (line.startsWith("ANGLE")) {
            AvlLineReader.ValuesRead v = AvlLineReader.readValues(st.lines, st.i, 1);
            s.angleDeg = v.values()[0];
            st.i = v.lastIndex();

        } else if (line.startsWith("SCALE")) {
            AvlLineReader.ValuesRead v = AvlLineReader.readValues(st.lines, st.i, 3);
            s.scale = toCoordinate(v.values());
            st.i = v.lastIndex();

        } else if (line.startsWith("TRANSLATE")) {
            AvlLineReader.ValuesRead v = AvlLineReader.readValues(st.lines, st.i, 3);
            s.translate = toCoordinate(v.values());
            st.i = v.lastIndex();

        } else if (line.startsWith("YDUPLICATE")) {
            AvlLineReader.ValuesRead v = AvlLineReader.readValues(st.lines, st.i, 1);
            s.yDuplicate = v.values()[0];
            st.i = v.lastIndex();

        } else if (line.equals("SECTION")) {
            int dataIdx = st.nextDataLine("SECTION");
            s.sections.add(parseSection(st.lines.get(dataIdx), dataIdx));
            st.i = dataIdx;

        } else if (line.startsWith("AFIL")) {
            SectionSpec sec = requireSection(st, "AFIL");
            int fileIdx = st.nextDataLine("AFIL");
            sec.airfoilFile = st.lines.get(fileIdx).strip();
            st.i = fileIdx;

        } else if (line.startsWith("NACA")) {
            SectionSpec sec = requireSection(st, "NACA");
            int codeIdx = st.nextDataLine("NACA");
            String[] t = AvlLineReader.tokens(st.lines.get(codeIdx));
            if (t.length == 0 || !t[0].matches("\\d{4}")) {
                throw new AvlFormatException("Designación NACA de 4 dígitos inválida: '" + st.lines.get(codeIdx) + "'", codeIdx);
            }
            sec.nacaCode = t[0];
            st.i = codeIdx;
        }
    }

    // x y z chord [ainc] (lo que venga después, ej. Nspan Sspace, se ignora)
    static SectionSpec parseSection(String data, int lineIdx) {
        String[] t = AvlLineReader.tokens(data);
        if (t.length < 4) {
            throw new AvlFormatException("SECTION requiere 'x y z chord [ainc]' y se leyó '" + data + "'", lineIdx);
        }
        int n = t.length > 4 ? 5 : 4;
        double[] v = AvlLineReader.parseDoubles(t, 0, n, "SECTION", lineIdx);
        double ainc = n == 5 ? v[4] : 0.0;
        return new SectionSpec(new Coordinate(v[0], v[1], v[2]), v[3], ainc);
    }

    static SectionSpec requireSection(ParserState st, String keyword) {
        SectionSpec sec = st.current.lastSection();
        if (sec == null) {
            throw new AvlFormatException(keyword + " antes de cualquier SECTION en la superficie '"
                    + st.current.name + "'", st.i);
        }
        return sec;
    }

    static Coordinate toCoordinate(double[] v) {
        return new Coordinate(v[0], v[1], v[2]);
    }
}
