package com.tallybook.ledger.source;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Set;

public interface TabularReader {

    /** Lower-case file extensions this reader handles, without the dot. */
    Set<String> extensions();

    TabularData read(Path file) throws IOException;
}
