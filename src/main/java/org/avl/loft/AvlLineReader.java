package org.avl.loft;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public class AvlLineReader {

    // resultado de leer n valores: los valores y el índice de la última línea consumida
    public record ValuesRead(double[] values, int lastIndex) {}

    // función para leer un AVL y devolver sus líneas sin espacios al inicio/fin.
    // Latin-1 acepta cualquier secuencia de bytes, así que la decodificación nunca falla.
    public static List<String> readLines(Path path) throws IOException {
        List<String> out = new ArrayList<>();
        try (BufferedReader br = Files.newBufferedReader(path, StandardCharsets.ISO_8859_1)) {
            String line;
            while ((line = br.readLine()) != null) out.add(line.strip());
        }
        return out;
    }

    static boolean isComment(String line) {
        return line.startsWith("#") || line.startsWith("!");
    }

    // devuelve el primer índice >= i que no es comentario (puede ser lines.size())
    public static int skipComments(List<String> lines, int i) {
        while (i < lines.size() && isComment(lines.get(i))) i++;
        return i;
    }

    static String[] tokens(String line) {
        String t = line.strip();
        return t.isEmpty() ? new String[0] : t.split("\\s+");
    }

    /**
     * Lee {@code n} valores para la palabra clave de la línea {@code i}.
     * Forma de una línea: {@code KEYWORD v1 .. vn}. Si la línea no trae suficientes tokens,
     * los valores salen de la siguiente línea que no sea comentario.
     */
    public static ValuesRead readValues(List<String> lines, int i, int n) {
        String line = lines.get(i);
        String keyword = keywordOf(line);
        String[] parts = tokens(line);
        if (parts.length >= n + 1) {
            return new ValuesRead(parseDoubles(parts, 1, n, keyword, i), i);
        }
        int next = skipComments(lines, i + 1);
        if (next >= lines.size()) {
            throw new AvlFormatException("Faltan " + n + " valores para " + keyword + ": fin de archivo", i);
        }
        String[] data = tokens(lines.get(next));
        if (data.length < n) {
            throw new AvlFormatException("Se esperaban " + n + " valores para " + keyword
                    + " pero hay " + data.length + ": '" + lines.get(next) + "'", next);
        }
        return new ValuesRead(parseDoubles(data, 0, n, keyword, next), next);
    }

    static double[] parseDoubles(String[] parts, int from, int n, String keyword, int lineIdx) {
        double[] v = new double[n];
        for (int k = 0; k < n; k++) {
            String s = parts[from + k];
            try {
                v[k] = Double.parseDouble(s);
            } catch (NumberFormatException e) {
                throw new AvlFormatException("Valor no numérico '" + s + "' en " + keyword, lineIdx, e);
            }
        }
        return v;
    }

    static String keywordOf(String line) {
        String[] p = tokens(line);
        return p.length == 0 ? "" : p[0];
    }
}
