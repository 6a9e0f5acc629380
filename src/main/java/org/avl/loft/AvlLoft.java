package org.avl.loft;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public class AvlLoft {

    static final String USAGE = "Uso: avl-loft <entrada.avl> [salida.scad] [--exclude-last-surface] [--log <archivo>]";

    public static void main(String[] args) {
        System.exit(run(args, System.err));
    }

    // devuelve el código de salida; separado de main para poder probarlo
    static int run(String[] args, PrintStream err) {
        List<String> positional = new ArrayList<>();
        boolean excludeLast = false;
        String logFile = null;
        for (int i = 0; i < args.length; i++) {
            if (args[i].equals("--exclude-last-surface")) {
                excludeLast = true;
            } else if (args[i].equals("--log")) {
                if (i + 1 >= args.length) {
                    err.println(USAGE);
                    err.println("  --log requiere un nombre de archivo");
                    return 1;
                }
                logFile = args[++i];
            } else {
                positional.add(args[i]);
            }
        }
        if (positional.isEmpty()) {
            err.println(USAGE);
            err.println("  Si no se indica salida.scad se deriva del nombre de entrada");
            return 1;
        }

        String inputAvl  = positional.get(0);
        String outputScad = positional.size() >= 2 ? positional.get(1) : deriveOutput(inputAvl);

        RunLogger log;
        try {
            log = (logFile == null) ? RunLogger.to(err) : RunLogger.toFile(logFile).tee(err);
        } catch (RuntimeException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
        try (log) {
            log.logf("AVL de entrada: %s", inputAvl);
            log.logf("Salida OpenSCAD: %s", outputScad);

            // 1) Parsear + construir perfiles
            List<SurfaceProfiles> surfaces = new AvlConverter(log)
                    .excludeLastSurface(excludeLast)
                    .convert(Path.of(inputAvl));
            if (surfaces.isEmpty()) throw new IllegalStateException("No hay superficies lofteables en " + inputAvl);

            // 2) Exportar
            File out = new File(outputScad);
            File dir = out.getAbsoluteFile().getParentFile();
            if (dir != null) dir.mkdirs();
            try (Writer w = new OutputStreamWriter(new FileOutputStream(out), StandardCharsets.UTF_8)) {
                w.write(ScadWriter.toScad(surfaces));
            }
            log.logf("Escrito %s", outputScad);
            return 0;
        } catch (Exception e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    // avion.avl -> avion.scad
    static String deriveOutput(String inputAvl) {
        int slash = Math.max(inputAvl.lastIndexOf('/'), inputAvl.lastIndexOf('\\'));
        int dot = inputAvl.lastIndexOf('.');
        String base = dot > slash ? inputAvl.substring(0, dot) : inputAvl;
        return base + ".scad";
    }
}
