package kaspi.lab.archiveService.dto;

import lombok.Builder;

import java.time.LocalDate;
import java.util.List;

// endDate is inclusive, up to the end of that day in UTC
@Builder
public record SearchCriteria(
        String ownerId,
        String text,
        List<String> tags,
        LocalDate startDate,
        LocalDate endDate,
        int size
) {}
