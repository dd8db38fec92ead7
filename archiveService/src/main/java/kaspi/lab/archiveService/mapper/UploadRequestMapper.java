package kaspi.lab.archiveService.mapper;

import kaspi.lab.archiveService.dto.CompleteUploadCommand;
import kaspi.lab.archiveService.dto.UploadedPart;
import kaspi.lab.archiveService.dto.request.CompleteUploadRequest;
import kaspi.lab.archiveService.dto.request.CompletedPartRequest;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring")
public interface UploadRequestMapper {

    @Mapping(target = "ownerId", source = "ownerId")
    @Mapping(target = "declaredSize", source = "request.fileSize")
    @Mapping(target = "archivePolicy", source = "request.policy")
    CompleteUploadCommand toCommand(CompleteUploadRequest request, String ownerId);

    // a missing part number becomes 0 and is rejected by the upload service
    UploadedPart toPart(CompletedPartRequest part);
}
