package com.example.ledger.dto;

import java.time.LocalDate;
import java.util.List;

/** Changes to a draft journal entry. Null fields are left unchanged. */
public record JournalEntryUpdateRequest(
    LocalDate date, String description, List<JournalLineRequest> lines) {}
