package org.iceforge.hlidskjalf.bucket;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/** Zip handling for DEM tiles, which several providers ship zipped. */
public final class DemArchives {
    private DemArchives() {}

    public static boolean isZip(Path p) {
        return p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".zip");
    }

    /**
     * Extracts {@code zip} into {@code destDir} and deletes the archive. Returns the extracted regular files.
     */
    public static List<Path> extractAndDelete(Path zip, Path destDir) throws IOException {
        Path base = destDir.toAbsolutePath().normalize();
        List<Path> out = new ArrayList<>();
        try (ZipInputStream zin = new ZipInputStream(Files.newInputStream(zip))) {
            ZipEntry e;
            while ((e = zin.getNextEntry()) != null) {
                Path target = base.resolve(e.getName()).normalize();
                if (!target.startsWith(base)) {
                    throw new IOException("Zip entry escapes target directory: " + e.getName());
                }
                if (e.isDirectory()) {
                    Files.createDirectories(target);
                    continue;
                }
                Files.createDirectories(target.getParent());
                copy(zin, target);
                out.add(target);
            }
        }
        Files.delete(zip);
        return out;
    }

    private static void copy(InputStream in, Path target) throws IOException {
        Path tmp = Files.createTempFile(target.getParent(), "unzip-", ".tmp");
        Files.copy(in, tmp, StandardCopyOption.REPLACE_EXISTING);
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}
