package org.avl.loft;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Recorre las superficies de un AVL y produce sus perfiles posicionados, listos para el
 * lofting. Una superficie a la vez, en orden de archivo.
 */
public class AvlConverter {

    private final RunLogger log;
    boolean excludeLastSurface = false;   // omitir la última superficie (suele ser la deriva)
    boolean mirrorProfiles     = false;   // true = agrega la copia espejada a nivel de perfiles

    public AvlConverter(RunLogger log) {
        this.log = log;
    }

    public AvlConverter excludeLastSurface(boolean v) { this.excludeLastSurface = v; return this; }
    public AvlConverter mirrorProfiles(boolean v) { this.mirrorProfiles = v; return this; }

    public List<SurfaceProfiles> convert(Path avlPath) throws IOException {
        Path baseDir = avlPath.toAbsolutePath().getParent();
        return convert(AvlParser.parse(avlPath), baseDir);
    }

    // baseDir: directorio contra el que se resuelven los nombres de AFIL
    public List<SurfaceProfiles> convert(List<SurfaceSpec> surfaces, Path baseDir) throws IOException {
        List<SurfaceSpec> todo = surfaces;
        if (excludeLastSurface && !surfaces.isEmpty()) {
            todo = surfaces.subList(0, surfaces.size() - 1);
            log.logf("Se omite la última superficie: %s", surfaces.get(surfaces.size() - 1).name);
        }

        List<SurfaceProfiles> out = new ArrayList<>();
        for (SurfaceSpec surf : todo) {
            SurfaceProfiles sp = convertSurface(surf, baseDir);
            if (sp == null) continue;
            out.add(sp);
            if (mirrorProfiles && sp.yDuplicate != null) out.add(sp.mirrored());
        }
        return out;
    }

    // null si la superficie no se puede loftear (menos de 2 secciones)
    SurfaceProfiles convertSurface(SurfaceSpec surf, Path baseDir) throws IOException {
        log.logf("Construyendo: %s", surf.name);
        if (!OrientationDetector.isLoftable(surf)) {
            log.logf("  %s tiene %d sección(es), se omite", surf.name, surf.sections.size());
            return null;
        }

        SurfaceOrientation orientation = OrientationDetector.detect(surf.sections);
        log.logf("  superficie %s (envergadura en %s)",
                orientation == SurfaceOrientation.VERTICAL ? "vertical" : "horizontal", orientation.spanAxis());

        // perfil de referencia UNA vez por superficie
        AirfoilProfile reference = referenceAirfoil(surf, baseDir);
        if (!reference.isClosed()) {
            log.warn("perfil de referencia %s no está cerrado (primer punto != último); el loft quedará abierto en el borde de fuga",
                    reference.name);
        }

        List<AirfoilProfile> airfoils = new ArrayList<>(surf.sections.size());
        for (SectionSpec sec : surf.sections) {
            AirfoilProfile af = sec.hasOwnAirfoil() ? resolveAirfoil(sec, baseDir) : reference;
            airfoils.add(AirfoilResampler.resampleToReference(reference, af, log));
        }

        List<PositionedProfile> profiles = ProfileBuilder.build(surf, airfoils, orientation);
        for (PositionedProfile p : profiles) {
            log.logf("  sección %s=%.3f, sec_x=%.5f, cuerda=%.3f, pts=%d",
                    Character.toLowerCase(orientation.spanAxis()), p.spanCoordinate,
                    p.sectionLeadingEdgeX, p.chord, p.points.length);
        }
        if (surf.yDuplicate != null) {
            log.logf("  YDUPLICATE respecto de Y = %.3f", surf.yDuplicate);
        }
        return new SurfaceProfiles(surf.name, orientation, profiles, surf.yDuplicate);
    }

    // primer perfil nombrado en la superficie; si ninguna sección nombra uno, el perfil por defecto
    AirfoilProfile referenceAirfoil(SurfaceSpec surf, Path baseDir) throws IOException {
        for (SectionSpec sec : surf.sections) {
            if (sec.hasOwnAirfoil()) return resolveAirfoil(sec, baseDir);
        }
        AirfoilProfile def = AirfoilLoader.defaultAirfoil();
        log.logf("  sin AFIL en %s, se usa %s", surf.name, def.name);
        return def;
    }

    // AFIL tiene prioridad sobre NACA; un AFIL que no existe es fatal (sin fallback)
    static AirfoilProfile resolveAirfoil(SectionSpec sec, Path baseDir) throws IOException {
        if (sec.airfoilFile != null) {
            Path p = baseDir == null ? Path.of(sec.airfoilFile) : baseDir.resolve(sec.airfoilFile);
            return AirfoilLoader.load(p);
        }
        return AirfoilLoader.naca4(sec.nacaCode);
    }
}
