package kaspi.lab.archiveService.mapper;

import kaspi.lab.archiveService.domain.ArchiveDocument;
import kaspi.lab.archiveService.domain.ArchiveEntity;
import kaspi.lab.archiveService.dto.response.ArchiveRecord;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring")
public interface ArchiveMapper {

    @Mapping(target = "id", ignore = true)
    ArchiveEntity toEntity(ArchiveRecord record);

    ArchiveRecord toRecord(ArchiveEntity entity);

    ArchiveDocument toDocument(ArchiveRecord record);

    // the index never sees the store-internal id
    @Mapping(target = "id", ignore = true)
    ArchiveRecord fromDocument(ArchiveDocument document);
}
