package com.tallybook.ledger.source;

import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/** Picks a {@link TabularReader} by file extension. */
@Component
public class TabularSources {

    private final List<TabularReader> readers;

    public TabularSources(List<TabularReader> readers) {
        this.readers = readers;
    }

    public boolean supports(Path file) {
        return readerFor(file).isPresent();
    }

    public TabularData read(Path file) throws IOException {
        TabularReader reader = readerFor(file)
                .orElseThrow(() -> new IOException("Unsupported file type: " + file.getFileName()));
        return reader.read(file);
    }

    private Optional<TabularReader> readerFor(Path file) {
        String ext = extension(file);
        return readers.stream().filter(r -> r.extensions().contains(ext)).findFirst();
    }

    static String extension(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
