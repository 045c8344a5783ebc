package se.nbis.sda.pipeline.model;

/**
 * Where an archived file lives and how many bytes it occupies there.
 */
public record ArchivedFile(String archivePath, long archiveSize) {
}
