package kaspi.lab.archiveService.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("failed_indexes")
public class FailedIndexEntity {

    @Id
    private Long id;
    @Column("file_id")
    private String fileId;
    private String reason;
    private Instant timestamp;
}
