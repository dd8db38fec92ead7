package kaspi.lab.archiveService.dto;

import lombok.Builder;

import java.util.List;

@Builder(toBuilder = true)
public record CompleteUploadCommand(
        String ownerId,
        String uploadId,
        String key,
        String filename,
        List<UploadedPart> parts,
        Long declaredSize,
        String contentType,
        List<String> tags,
        String archivePolicy
) {}
