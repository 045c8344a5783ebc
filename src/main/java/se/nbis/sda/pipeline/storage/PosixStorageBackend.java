package se.nbis.sda.pipeline.storage;

import lombok.extern.slf4j.Slf4j;

import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Set;

/**
 * {@link StorageBackend} over a directory tree. Every path is resolved below the configured root.
 */
@Slf4j
public class PosixStorageBackend implements StorageBackend {

    private static final Set<PosixFilePermission> FILE_PERMISSIONS = PosixFilePermissions.fromString("rw-r-----");

    private final Path root;

    public PosixStorageBackend(Path root) {
        this.root = root.toAbsolutePath().normalize();
        log.info("POSIX storage backend initialized at '{}'.", this.root);
    }

    @Override
    public long size(String path) throws IOException {
        return Files.size(resolve(path));
    }

    @Override
    public InputStream openReader(String path) throws IOException {
        Path file = resolve(path);
        log.debug("Opening '{}' for reading.", file);
        return Files.newInputStream(file);
    }

    @Override
    public OutputStream openWriter(String path) throws IOException {
        Path file = resolve(path);
        Path parent = file.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        log.debug("Opening '{}' for writing.", file);
        OutputStream out = Files.newOutputStream(file, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING,
                                                 StandardOpenOption.WRITE);
        try {
            if (Files.getFileStore(file).supportsFileAttributeView("posix")) {
                Files.setPosixFilePermissions(file, FILE_PERMISSIONS);
            }
        } catch (IOException e) {
            out.close();
            throw e;
        }
        return new PosixFileOutputStream(out, file);
    }

    /**
     * Joins {@code path} onto the root and normalizes the result. Leading separators are ignored so that
     * absolute-looking paths stay inside the root as well.
     *
     * @throws InvalidStoragePathException if the normalized path is not below the root.
     */
    Path resolve(String path) {
        if (path == null || path.isBlank()) {
            throw new InvalidStoragePathException("Storage path must not be empty");
        }
        String relative = path.replaceFirst("^/+", "");
        Path resolved = root.resolve(relative).normalize();
        if (!resolved.startsWith(root) || resolved.equals(root)) {
            throw new InvalidStoragePathException("Path '" + path + "' resolves outside of the storage root");
        }
        return resolved;
    }

    /**
     * Deletes the half written file on {@link #abort()}.
     */
    private static final class PosixFileOutputStream extends FilterOutputStream implements Abortable {

        private final Path file;

        private PosixFileOutputStream(OutputStream out, Path file) {
            super(out);
            this.file = file;
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            out.write(b, off, len);
        }

        @Override
        public void abort() throws IOException {
            try {
                out.close();
            } finally {
                Files.deleteIfExists(file);
                log.warn("Discarded partially written '{}'.", file);
            }
        }
    }
}
