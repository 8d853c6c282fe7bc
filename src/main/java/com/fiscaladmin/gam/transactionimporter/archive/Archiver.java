package com.fiscaladmin.gam.transactionimporter.archive;

import com.fiscaladmin.gam.transactionimporter.parser.SourceKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Moves consumed statement files into {@code <archiveRoot>/yyyy/MM/dd/}.
 * <p>
 * Key behaviours:
 * <ul>
 *   <li>The original file name is kept; on collision {@code _1}, {@code _2}, ... is
 *       inserted before the extension. An existing archive file is never overwritten</li>
 *   <li>Other I/O failures are retried up to the configured number of attempts</li>
 *   <li>The source is never deleted except by the move itself</li>
 *   <li>An archived file can be moved back out with {@link #restore(Path, Path)}
 *       under the same no-overwrite rule</li>
 * </ul>
 */
public class Archiver {

    private static final Logger LOG = LoggerFactory.getLogger(Archiver.class);

    private static final DateTimeFormatter DAY_DIR = DateTimeFormatter.ofPattern("uuuu/MM/dd");
    private static final int MAX_SUFFIX = 10000;

    private final Path archiveRoot;
    private final Clock clock;
    private final int attempts;

    public Archiver(Path archiveRoot, Clock clock, int attempts) {
        if (attempts < 1) {
            throw new IllegalArgumentException("attempts must be at least 1");
        }
        this.archiveRoot = archiveRoot;
        this.clock = clock;
        this.attempts = attempts;
    }

    public Path getArchiveRoot() {
        return archiveRoot;
    }

    /**
     * Moves a file into today's archive directory.
     *
     * @return the archived path
     * @throws IOException if the file cannot be moved after all attempts
     */
    public Path archive(Path source) throws IOException {
        Path dayDir = archiveRoot.resolve(LocalDate.now(clock).format(DAY_DIR));
        IOException last = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                Files.createDirectories(dayDir);
                Path target = moveWithoutOverwrite(source, dayDir);
                LOG.info("Archived {} to {}", source.getFileName(), target);
                return target;
            } catch (NoSuchFileException e) {
                throw e;
            } catch (IOException e) {
                last = e;
                LOG.warn("Archive attempt {}/{} for {} failed: {}", attempt, attempts, source.getFileName(),
                        e.getMessage());
            }
        }
        throw last;
    }

    /**
     * Lists archived statement files, oldest day first and by name within a day.
     * A missing archive root means nothing has been archived yet.
     */
    public List<Path> listArchived() throws IOException {
        if (!Files.isDirectory(archiveRoot)) {
            return Collections.emptyList();
        }
        try (Stream<Path> walk = Files.walk(archiveRoot)) {
            return walk.filter(Files::isRegularFile)
                    .filter(p -> SourceKind.of(p).isPresent())
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    /**
     * Moves an archived file back into {@code targetDir} so it can be imported again.
     * The name is kept unless a file of that name is already there, in which case a
     * suffix is added as when archiving.
     *
     * @return the restored path
     * @throws IllegalArgumentException if {@code archived} is not inside the archive root
     * @throws NoSuchFileException      if the archived file does not exist
     */
    public Path restore(Path archived, Path targetDir) throws IOException {
        Path root = archiveRoot.toAbsolutePath().normalize();
        Path source = archived.toAbsolutePath().normalize();
        if (source.equals(root) || !source.startsWith(root)) {
            throw new IllegalArgumentException(archived + " is not inside the archive " + archiveRoot);
        }
        if (!Files.isRegularFile(source)) {
            throw new NoSuchFileException(archived.toString());
        }
        Files.createDirectories(targetDir);
        Path target = moveWithoutOverwrite(source, targetDir);
        LOG.info("Restored {} to {}", source.getFileName(), target);
        return target;
    }

    private static Path moveWithoutOverwrite(Path source, Path dir) throws IOException {
        String fileName = source.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String base = dot > 0 ? fileName.substring(0, dot) : fileName;
        String ext = dot > 0 ? fileName.substring(dot) : "";

        for (int i = 0; i < MAX_SUFFIX; i++) {
            Path target = dir.resolve(i == 0 ? fileName : base + "_" + i + ext);
            if (Files.exists(target)) {
                continue;
            }
            try {
                return Files.move(source, target);
            } catch (FileAlreadyExistsException e) {
                LOG.debug("Archive name {} taken concurrently, trying next suffix", target.getFileName());
            }
        }
        throw new IOException("No free archive name for " + fileName + " in " + dir);
    }
}
