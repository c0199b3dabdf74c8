package com.tallybook.ledger.service;

public enum ConflictAction {
    INSERT,
    UPDATE,
    SKIP
}
