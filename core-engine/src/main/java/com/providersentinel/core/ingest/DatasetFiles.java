package com.providersentinel.core.ingest;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Locations of the three input sources inside a data directory.
 *
 * <ul>
 * <li>{@value #CLAIMS_FILE}: billed-service claims</li>
 * <li>{@value #EXCLUSIONS_FILE}: the exclusion list</li>
 * <li>{@value #REGISTRY_GLOB}: the provider registry; the lexicographically
 * first match wins and the companion {@code *_fileheader.csv} is ignored</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class DatasetFiles {

    public static final String CLAIMS_FILE = "claims.csv";
    public static final String EXCLUSIONS_FILE = "UPDATED.csv";
    public static final String REGISTRY_GLOB = "npidata_pfile*.csv";

    private static final String HEADER_SUFFIX = "_fileheader.csv";

    private final Path claims;
    private final Path exclusions;
    private final Path registry;

    public DatasetFiles(Path claims, Path exclusions, Path registry) {
        this.claims = Objects.requireNonNull(claims, "claims must not be null");
        this.exclusions = Objects.requireNonNull(exclusions, "exclusions must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    /**
     * Resolve the three sources under {@code dataDir}.
     *
     * @param dataDir directory holding the inputs
     * @return the located files
     * @throws DatasetLoadException if the directory or any source is missing
     */
    public static DatasetFiles locate(Path dataDir) {
        Objects.requireNonNull(dataDir, "dataDir must not be null");
        if (!Files.isDirectory(dataDir)) {
            throw new DatasetLoadException("Data directory not found: " + dataDir.toAbsolutePath());
        }
        return new DatasetFiles(
                requireFile(dataDir.resolve(CLAIMS_FILE)),
                requireFile(dataDir.resolve(EXCLUSIONS_FILE)),
                findRegistry(dataDir));
    }

    private static Path requireFile(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new DatasetLoadException("Required input not found: " + file);
        }
        return file;
    }

    private static Path findRegistry(Path dataDir) {
        List<Path> candidates = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dataDir, REGISTRY_GLOB)) {
            for (Path candidate : stream) {
                if (!candidate.getFileName().toString().endsWith(HEADER_SUFFIX)) {
                    candidates.add(candidate);
                }
            }
        } catch (IOException e) {
            throw new DatasetLoadException("Failed to list data directory: " + dataDir, e);
        }
        if (candidates.isEmpty()) {
            throw new DatasetLoadException("Required input not found: " + dataDir.resolve(REGISTRY_GLOB));
        }
        Collections.sort(candidates);
        return candidates.get(0);
    }

    public Path getClaims() {
        return claims;
    }

    public Path getExclusions() {
        return exclusions;
    }

    public Path getRegistry() {
        return registry;
    }

    @Override
    public String toString() {
        return "DatasetFiles{" +
                "claims=" + claims +
                ", exclusions=" + exclusions +
                ", registry=" + registry +
                '}';
    }
}
