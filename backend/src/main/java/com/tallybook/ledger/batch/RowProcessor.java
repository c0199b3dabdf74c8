package com.tallybook.ledger.batch;

import java.util.Map;

@FunctionalInterface
public interface RowProcessor {

    /**
     * @param rowNo 1-based position of the row among the data rows
     * @param row   cell values keyed by header
     */
    RowOutcome process(int rowNo, Map<String, String> row) throws Exception;
}
