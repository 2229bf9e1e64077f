package com.example.archiver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * Finds the crawler's on-disk artifacts under a job's output directory: temp dirs,
 * resume configs and WARC files.
 */
public final class ArtifactLocator {
    private static final Logger LOGGER = LoggerFactory.getLogger(ArtifactLocator.class);

    public static final String TEMP_DIR_PREFIX = ".tmp";
    public static final String RESUME_CONFIG_FILE_NAME = ".zimit_resume.yaml";
    static final List<String> RESUME_CONFIG_PATTERNS = List.of(
            "collections/crawl-*/crawls/crawl-*.yaml",
            "collections/crawl-*/crawls/crawl-*.yml",
            "collections/crawl-*/crawls/*.yaml",
            "collections/crawl-*/crawls/*.yml",
            "collections/crawl-*/crawl-*.yaml",
            "collections/crawl-*/crawl-*.yml"
    );
    private static final int RESUME_CONFIG_MAX_DEPTH = 4;

    private final Path outputDirectory;

    public ArtifactLocator(Path outputDirectory) {
        this.outputDirectory = outputDirectory.toAbsolutePath().normalize();
    }

    /**
     * Lists the {@code .tmp*} directories directly under the output directory, oldest first.
     */
    public List<Path> discoverTempDirs() {
        List<Path> found = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(outputDirectory, TEMP_DIR_PREFIX + "*")) {
            for (Path item : stream) {
                if (Files.isDirectory(item)) {
                    found.add(realPath(item));
                }
            }
        } catch (IOException ex) {
            LOGGER.warn("Failed scanning {} for temp dirs: {}", outputDirectory, ex.getMessage());
            return List.of();
        }
        found.sort(Comparator.comparingLong(ArtifactLocator::modifiedMillis));
        return found;
    }

    /**
     * The most recently modified temp dir, used when the crawler log does not name one.
     */
    public Optional<Path> newestTempDir() {
        List<Path> tempDirs = discoverTempDirs();
        if (tempDirs.isEmpty()) {
            LOGGER.info("Fallback did not find any '{}*' directories.", TEMP_DIR_PREFIX);
            return Optional.empty();
        }
        Path newest = tempDirs.get(tempDirs.size() - 1);
        LOGGER.info("Fallback found latest temp dir: {}", newest);
        return Optional.of(newest);
    }

    /**
     * Finds the newest crawl config YAML in one temp dir, trying the known layouts in order.
     */
    public Optional<Path> findResumeConfig(Path tempDir) {
        if (!Files.isDirectory(tempDir)) {
            LOGGER.warn("Cannot search for YAML, invalid temp dir: {}", tempDir);
            return Optional.empty();
        }
        List<Path> candidates;
        try (Stream<Path> walk = Files.walk(tempDir, RESUME_CONFIG_MAX_DEPTH)) {
            candidates = walk.filter(Files::isRegularFile).toList();
        } catch (IOException ex) {
            LOGGER.warn("Error searching config YAML in {}: {}", tempDir, ex.getMessage());
            return Optional.empty();
        }
        for (String pattern : RESUME_CONFIG_PATTERNS) {
            PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + pattern);
            Optional<Path> newest = candidates.stream()
                    .filter(candidate -> matcher.matches(tempDir.relativize(candidate)))
                    .max(Comparator.comparingLong(ArtifactLocator::modifiedMillis));
            if (newest.isPresent()) {
                LOGGER.info("Found latest config YAML (pattern '{}'): {}", pattern, newest.get());
                return Optional.of(realPath(newest.get()));
            }
        }
        LOGGER.info("No config YAML files found in {}.", tempDir);
        return Optional.empty();
    }

    /**
     * The newest resume config across several temp dirs.
     */
    public Optional<Path> findResumeConfig(List<Path> tempDirs) {
        return tempDirs.stream()
                .map(this::findResumeConfig)
                .flatMap(Optional::stream)
                .max(Comparator.comparingLong(ArtifactLocator::modifiedMillis));
    }

    public Path stableResumeConfigPath() {
        return outputDirectory.resolve(RESUME_CONFIG_FILE_NAME);
    }

    public Optional<Path> stableResumeConfig() {
        Path stable = stableResumeConfigPath();
        return Files.isRegularFile(stable) ? Optional.of(stable) : Optional.empty();
    }

    /**
     * Copies a discovered resume config to the stable location via a temp file and rename.
     */
    public Optional<Path> persistResumeConfig(Path configYaml) {
        Path destination = stableResumeConfigPath();
        Path temp = destination.resolveSibling(RESUME_CONFIG_FILE_NAME + ".tmp." + ProcessHandle.current().pid());
        try {
            Files.copy(configYaml, temp, StandardCopyOption.REPLACE_EXISTING);
            Files.move(temp, destination, StandardCopyOption.REPLACE_EXISTING);
            return Optional.of(destination);
        } catch (IOException ex) {
            LOGGER.warn("Could not persist resume config {} to {}: {}", configYaml, destination, ex.getMessage());
            try {
                Files.deleteIfExists(temp);
            } catch (IOException cleanupEx) {
                ex.addSuppressed(cleanupEx);
            }
            return Optional.empty();
        }
    }

    /**
     * Resolves the config a resumed crawl should start from: the stable copy if present,
     * otherwise the newest one found in {@code tempDirs}, which is then made stable.
     */
    public Optional<Path> locateResumeConfig(List<Path> tempDirs) {
        Optional<Path> stable = stableResumeConfig();
        if (stable.isPresent()) {
            return stable;
        }
        Optional<Path> discovered = findResumeConfig(tempDirs);
        if (discovered.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(persistResumeConfig(discovered.get()).orElse(discovered.get()));
    }

    /**
     * Finds all non-empty WARC files under the given temp dirs, sorted and de-duplicated.
     * Each temp dir is searched below {@code collections/} when present, else as a whole.
     */
    public List<Path> findWarcs(List<Path> tempDirs) {
        TreeSet<Path> warcs = new TreeSet<>();
        LOGGER.info("Searching for WARC files in {} temp dir path(s)...", tempDirs.size());
        for (Path tempDir : tempDirs) {
            if (!Files.isDirectory(tempDir)) {
                LOGGER.warn("Skipping WARC search in non-existent dir: {}", tempDir);
                continue;
            }
            Path searchRoot = tempDir.resolve("collections");
            if (!Files.isDirectory(searchRoot)) {
                LOGGER.info("No collections/ directory found in {}; scanning temp dir.", tempDir);
                searchRoot = tempDir;
            }
            int before = warcs.size();
            try (Stream<Path> walk = Files.walk(searchRoot)) {
                walk.filter(ArtifactLocator::isWarc)
                        .filter(ArtifactLocator::nonEmptyFile)
                        .map(ArtifactLocator::realPath)
                        .forEach(warcs::add);
            } catch (IOException ex) {
                LOGGER.error("Error searching WARCs in {}", tempDir, ex);
            }
            LOGGER.info("Found {} WARC file(s) under {}", warcs.size() - before, searchRoot);
        }
        LOGGER.info("Total unique WARC files found: {}", warcs.size());
        return List.copyOf(warcs);
    }

    /**
     * Deletes the given temp dirs. Paths that are not {@code .tmp*} directories are skipped.
     * Returns the number of directories removed.
     */
    public int deleteTempDirs(List<Path> tempDirs) {
        int deleted = 0;
        for (Path tempDir : tempDirs) {
            Path fileName = tempDir.getFileName();
            if (fileName == null || !fileName.toString().startsWith(TEMP_DIR_PREFIX) || !Files.isDirectory(tempDir)) {
                LOGGER.warn("Skipping cleanup: {}", tempDir);
                continue;
            }
            try {
                deleteRecursively(tempDir);
                LOGGER.info("Deleted: {}", tempDir);
                deleted++;
            } catch (IOException ex) {
                LOGGER.error("Failed to delete {}", tempDir, ex);
            }
        }
        return deleted;
    }

    public Path outputDirectory() {
        return outputDirectory;
    }

    private static void deleteRecursively(Path root) throws IOException {
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null) {
                    throw exc;
                }
                Files.delete(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private static boolean isWarc(Path path) {
        String name = path.getFileName().toString();
        return name.endsWith(".warc.gz") || name.endsWith(".warc");
    }

    private static boolean nonEmptyFile(Path path) {
        try {
            return Files.isRegularFile(path) && Files.size(path) > 0;
        } catch (IOException ex) {
            LOGGER.warn("Could not stat WARC file {}: {}", path, ex.getMessage());
            return false;
        }
    }

    static long modifiedMillis(Path path) {
        try {
            return Files.getLastModifiedTime(path).toMillis();
        } catch (IOException ex) {
            LOGGER.warn("Failed to stat {}: {}", path, ex.getMessage());
            return 0L;
        }
    }

    private static Path realPath(Path path) {
        try {
            return path.toRealPath();
        } catch (IOException ex) {
            return path.toAbsolutePath().normalize();
        }
    }
}
