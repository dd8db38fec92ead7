package kaspi.lab.archiveService.service;

import kaspi.lab.archiveService.dto.response.ArchiveRecord;
import org.springframework.http.codec.multipart.FilePart;
import reactor.core.publisher.Mono;

import java.util.List;

public interface DirectUploadService {
    Mono<ArchiveRecord> archive(String ownerId, FilePart filePart, List<String> tags, String archivePolicy);
}
