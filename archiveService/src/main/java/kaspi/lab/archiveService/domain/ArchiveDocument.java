package kaspi.lab.archiveService.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.elasticsearch.annotations.Document;
import org.springframework.data.elasticsearch.annotations.Field;
import org.springframework.data.elasticsearch.annotations.FieldType;
import org.springframework.data.elasticsearch.annotations.InnerField;
import org.springframework.data.elasticsearch.annotations.MultiField;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(indexName = ArchiveDocument.INDEX_NAME, createIndex = false)
public class ArchiveDocument {

    public static final String INDEX_NAME = "archives";
    public static final String OWNER_ID = "owner_id";
    public static final String TAGS = "tags";
    public static final String ARCHIVED_AT = "archived_at";
    public static final String SIZE = "size";

    @Id
    @Field(name = "file_id", type = FieldType.Keyword)
    private String fileId;

    @Field(name = OWNER_ID, type = FieldType.Keyword)
    private String ownerId;

    @MultiField(
            mainField = @Field(type = FieldType.Text),
            otherFields = @InnerField(suffix = "keyword", type = FieldType.Keyword)
    )
    private String filename;

    @Field(name = "original_filename", type = FieldType.Text)
    private String originalFilename;

    @Field(name = "content_type", type = FieldType.Keyword)
    private String contentType;

    @Field(name = "original_content_type", type = FieldType.Keyword)
    private String originalContentType;

    @Field(name = "was_compressed", type = FieldType.Boolean)
    private boolean wasCompressed;

    @Field(name = SIZE, type = FieldType.Long)
    private long size;

    @Field(name = TAGS, type = FieldType.Keyword)
    private List<String> tags;

    @Field(name = "archive_policy", type = FieldType.Keyword)
    private String archivePolicy;

    @Field(name = ARCHIVED_AT, type = FieldType.Date)
    private Instant archivedAt;

    @Field(type = FieldType.Keyword)
    private String status;

    @Field(type = FieldType.Keyword)
    private String location;
}
