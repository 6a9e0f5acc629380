package org.avl.loft;

import java.io.File;
import java.io.FileOutputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** Logger con timestamp tipo [HH:mm:ss.SSS] */
public final class RunLogger implements AutoCloseable {
    private final List<PrintStream> outs = new ArrayList<>();
    private final boolean closeOnExit;
    private final DateTimeFormatter fmt = DateTimeFormatter.ofPattern("HH:mm:ss.SSS");

    RunLogger(PrintStream out, boolean closeOnExit) {
        this.outs.add(out);
        this.closeOnExit = closeOnExit;
    }

    public static RunLogger to(PrintStream out) {
        return new RunLogger(out, false);
    }

    // logger que descarta todo (uso desde tests o como librería)
    public static RunLogger silent() {
        return new RunLogger(new PrintStream(OutputStream.nullOutputStream()), true);
    }

    public static RunLogger toFile(String path) {
        try {
            File f = new File(path);
            File dir = f.getParentFile();
            if (dir != null) dir.mkdirs();
            PrintStream ps = new PrintStream(new FileOutputStream(f, /*append*/false), true, StandardCharsets.UTF_8);
            return new RunLogger(ps, true);
        } catch (Exception e) {
            throw new RuntimeException("No se pudo abrir el log " + path, e);
        }
    }

    // duplica la salida hacia otro stream (ej. consola + archivo)
    public RunLogger tee(PrintStream other) {
        outs.add(other);
        return this;
    }

    public void log(String msg) {
        String t = "[" + LocalTime.now().format(fmt) + "] ";
        for (PrintStream out : outs) out.println(t + msg);
    }

    public void logf(String pattern, Object... args) {
        log(String.format(Locale.US, pattern, args));
    }

    public void warn(String pattern, Object... args) {
        log("WARN " + String.format(Locale.US, pattern, args));
    }

    @Override public void close() {
        for (PrintStream out : outs) out.flush();
        if (closeOnExit) outs.get(0).close();
    }
}
