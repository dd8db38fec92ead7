package kaspi.lab.archiveService.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@Validated
@ConfigurationProperties(prefix = "archive")
public class ArchiveProperties {

    @Valid
    private Storage storage = new Storage();

    @Valid
    private Cache cache = new Cache();

    @Valid
    private Search search = new Search();

    @Valid
    private Compression compression = new Compression();

    @Valid
    private Startup startup = new Startup();

    @Data
    public static class Storage {

        @NotBlank(message = "Адрес хранилища (endpoint) должен быть указан")
        private String endpoint = "http://localhost:9000";

        @NotBlank(message = "Регион хранилища должен быть указан")
        private String region = "us-east-1";

        private String accessKey;

        private String secretKey;

        // may be blank at boot, gateway calls then fail with ConfigurationException
        private String bucket;

        private boolean pathStyleAccess = true;

        @NotBlank(message = "Префикс ключей (key-prefix) должен быть указан")
        private String keyPrefix = "archives";

        @NotNull(message = "TTL ссылки на часть должен быть указан")
        private Duration partUrlTtl = Duration.ofHours(1);

        @NotNull(message = "TTL ссылки на скачивание должен быть указан")
        private Duration downloadUrlTtl = Duration.ofHours(1);
    }

    @Data
    public static class Cache {

        @NotBlank
        private String keyPrefix = "archive:";

        @NotNull(message = "TTL кэша должен быть указан")
        private Duration ttl = Duration.ofSeconds(3600);
    }

    @Data
    public static class Search {

        @Min(value = 1, message = "Размер списка последних загрузок должен быть не менее 1")
        private int recentSize = 5;

        @Min(1)
        private int defaultPageSize = 20;

        @Min(1)
        private int maxPageSize = 100;
    }

    @Data
    public static class Compression {

        // already compressed, stored as-is
        private List<String> denylist = new ArrayList<>(List.of(
                "application/zip",
                "application/gzip",
                "application/x-gzip",
                "application/x-7z-compressed",
                "application/x-rar-compressed",
                "application/vnd.rar",
                "application/x-bzip2",
                "application/x-xz",
                "image/jpeg",
                "image/png",
                "image/gif",
                "image/webp",
                "video/mp4",
                "video/quicktime",
                "video/webm",
                "audio/mpeg",
                "audio/mp4",
                "audio/ogg"
        ));
    }

    @Data
    public static class Startup {

        private boolean enabled = true;

        @Min(1)
        private int storeAttempts = 3;

        @NotNull
        private Duration storeRetryDelay = Duration.ofSeconds(2);

        @Min(1)
        private int indexAttempts = 5;

        @NotNull
        private Duration indexRetryDelay = Duration.ofSeconds(5);
    }
}
