package com.tallybook.ledger.batch;

import com.tallybook.ledger.source.TabularData;

import java.io.IOException;

@FunctionalInterface
public interface RowSource {
    TabularData load() throws IOException;
}
