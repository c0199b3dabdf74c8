package com.tallybook.ledger.batch;

/**
 * Result of processing one input row.
 *
 * @param kind    how the row counts toward the task totals
 * @param skipped price values left untouched because a record already existed
 * @param reason  error text, only for {@link Kind#ERROR}
 */
public record RowOutcome(Kind kind, int skipped, String reason) {

    public enum Kind { SUCCESS, EXCLUDED, ERROR }

    public static RowOutcome success(int skipped) {
        return new RowOutcome(Kind.SUCCESS, skipped, null);
    }

    /** Row neither succeeded nor failed, e.g. blank name or nothing written. */
    public static RowOutcome excluded(int skipped) {
        return new RowOutcome(Kind.EXCLUDED, skipped, null);
    }

    public static RowOutcome error(String reason) {
        return new RowOutcome(Kind.ERROR, 0, reason);
    }

    public boolean isError() {
        return kind == Kind.ERROR;
    }
}
