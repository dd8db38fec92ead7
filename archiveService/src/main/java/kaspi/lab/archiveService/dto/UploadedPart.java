package kaspi.lab.archiveService.dto;

public record UploadedPart(int partNumber, String etag) {}
