package kaspi.lab.archiveService.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("archives")
public class ArchiveEntity {
    @Id
    private Long id;
    @Column("file_id")
    private String fileId;
    @Column("owner_id")
    private String ownerId;
    private String filename;
    @Column("original_filename")
    private String originalFilename;
    @Column("content_type")
    private String contentType;
    @Column("original_content_type")
    private String originalContentType;
    @Column("was_compressed")
    private boolean wasCompressed;
    private long size;
    private List<String> tags;
    @Column("archive_policy")
    private String archivePolicy;
    @Column("archived_at")
    private Instant archivedAt;
    private String status;
    private String location;
}
