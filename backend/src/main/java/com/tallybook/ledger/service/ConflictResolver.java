package com.tallybook.ledger.service;

import com.tallybook.ledger.model.ConflictMode;
import com.tallybook.ledger.model.PriceRecord;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Decides what happens to an incoming value when a record for the same
 * (product, company, period) may already exist.
 */
@Component
public class ConflictResolver {

    private static final DateTimeFormatter NOTE_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");

    private final Clock clock;

    public ConflictResolver() {
        this(Clock.systemDefaultZone());
    }

    ConflictResolver(Clock clock) {
        this.clock = clock;
    }

    public ConflictAction resolve(PriceRecord existing, ConflictMode mode) {
        if (existing == null) return ConflictAction.INSERT;
        return mode == ConflictMode.OVERWRITE ? ConflictAction.UPDATE : ConflictAction.SKIP;
    }

    public String updateNote() {
        return "Updated on " + LocalDate.now(clock).format(NOTE_DATE);
    }

    public String importNote() {
        return "Imported on " + LocalDate.now(clock).format(NOTE_DATE);
    }
}
