package com.tallybook.ledger.service;

/** Rejected submission; no task is created. */
public class ImportSubmissionException extends IllegalArgumentException {
    public ImportSubmissionException(String message) {
        super(message);
    }
}
