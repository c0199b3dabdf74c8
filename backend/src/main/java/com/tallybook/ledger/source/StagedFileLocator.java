package com.tallybook.ledger.source;

import com.tallybook.ledger.config.ImportSettings;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Resolves an opaque data reference to a file already staged by the upload step.
 * Staged files are named either {@code <ref>} or {@code <ref>_<original filename>}.
 */
@Component
public class StagedFileLocator {

    private static final Pattern SAFE_REF = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]{0,127}");

    private final ImportSettings settings;

    public StagedFileLocator(ImportSettings settings) {
        this.settings = settings;
    }

    public Path stagingDir() {
        return Path.of(settings.getStagingDir()).toAbsolutePath().normalize();
    }

    public Optional<Path> locate(String dataRef) throws IOException {
        if (dataRef == null || !SAFE_REF.matcher(dataRef).matches() || dataRef.contains("..")) {
            return Optional.empty();
        }
        Path dir = stagingDir();
        if (!Files.isDirectory(dir)) {
            return Optional.empty();
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(p -> {
                        String name = p.getFileName().toString();
                        return name.equals(dataRef) || name.startsWith(dataRef + "_");
                    })
                    .sorted()
                    .findFirst();
        }
    }

    public String originalFilename(Path staged, String dataRef) {
        String name = staged.getFileName().toString();
        String prefix = dataRef + "_";
        return name.startsWith(prefix) ? name.substring(prefix.length()) : name;
    }

    public List<Path> listStaged() throws IOException {
        Path dir = stagingDir();
        if (!Files.isDirectory(dir)) return List.of();
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(Files::isRegularFile).toList();
        }
    }
}
