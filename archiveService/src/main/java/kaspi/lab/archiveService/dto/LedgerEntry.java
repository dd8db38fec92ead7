package kaspi.lab.archiveService.dto;

import java.time.Instant;

public record LedgerEntry(String fileId, String reason, Instant timestamp) {}
