package org.avl.loft;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class AvlLoftTest {

    static final String WING = "SURFACE\nWing\nYDUPLICATE 0.0\nSECTION\n0 0 0 1\nSECTION\n0 2 0 0.5\n";

    @Test
    void run_withoutArgumentsPrintsUsage() {
        ByteArrayOutputStream err = new ByteArrayOutputStream();

        int code = AvlLoft.run(new String[0], new PrintStream(err, true, StandardCharsets.UTF_8));

        assertThat(code).isEqualTo(1);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("Uso:");
    }

    @Test
    void run_writesScadNextToInputAndLogFile(@TempDir Path dir) throws Exception {
        Path avl = dir.resolve("ala.avl");
        Files.writeString(avl, WING);
        Path log = dir.resolve("logs/run.log");
        ByteArrayOutputStream err = new ByteArrayOutputStream();

        int code = AvlLoft.run(new String[]{avl.toString(), "--log", log.toString()},
                new PrintStream(err, true, StandardCharsets.UTF_8));

        assertThat(code).isZero();
        Path scad = dir.resolve("ala.scad");
        assertThat(scad).exists();
        assertThat(Files.readString(scad)).contains("polyhedron(").contains("mirror([0, 1, 0])");
        assertThat(Files.readString(log)).contains("Construyendo: Wing").contains("Escrito");
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("Construyendo: Wing");
    }

    @Test
    void run_reportsFormatErrorsAndFails(@TempDir Path dir) throws Exception {
        Path avl = dir.resolve("malo.avl");
        Files.writeString(avl, "SURFACE\nWing\nAFIL\nx.dat\n");
        ByteArrayOutputStream err = new ByteArrayOutputStream();

        int code = AvlLoft.run(new String[]{avl.toString(), dir.resolve("o.scad").toString()},
                new PrintStream(err, true, StandardCharsets.UTF_8));

        assertThat(code).isEqualTo(1);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("Error:").contains("AFIL");
        assertThat(dir.resolve("o.scad")).doesNotExist();
    }

    @Test
    void run_unwritableLogFileIsReportedAsError(@TempDir Path dir) throws Exception {
        Path avl = dir.resolve("ala.avl");
        Files.writeString(avl, WING);
        Path blocker = dir.resolve("bloqueo");
        Files.writeString(blocker, "no soy un directorio");
        ByteArrayOutputStream err = new ByteArrayOutputStream();

        int code = AvlLoft.run(new String[]{avl.toString(), "--log", blocker.resolve("run.log").toString()},
                new PrintStream(err, true, StandardCharsets.UTF_8));

        assertThat(code).isEqualTo(1);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("Error:").contains("run.log");
        assertThat(dir.resolve("ala.scad")).doesNotExist();
    }

    @Test
    void run_logFlagWithoutFileNamePrintsUsage(@TempDir Path dir) throws Exception {
        Path avl = dir.resolve("ala.avl");
        Files.writeString(avl, WING);
        ByteArrayOutputStream err = new ByteArrayOutputStream();

        int code = AvlLoft.run(new String[]{avl.toString(), "--log"},
                new PrintStream(err, true, StandardCharsets.UTF_8));

        assertThat(code).isEqualTo(1);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("Uso:").contains("--log");
        assertThat(dir.resolve("--log")).doesNotExist();
        assertThat(dir.resolve("ala.scad")).doesNotExist();
    }

    @Test
    void deriveOutput_replacesExtension() {
        assertThat(AvlLoft.deriveOutput("modelos/supra.avl")).isEqualTo("modelos/supra.scad");
        assertThat(AvlLoft.deriveOutput("sin_ext")).isEqualTo("sin_ext.scad");
        assertThat(AvlLoft.deriveOutput("dir.v2/modelo")).isEqualTo("dir.v2/modelo.scad");
    }
}
