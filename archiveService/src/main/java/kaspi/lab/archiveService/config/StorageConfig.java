package kaspi.lab.archiveService.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

import java.net.URI;

@Slf4j
@Configuration
public class StorageConfig {

    @Bean(destroyMethod = "close")
    public S3Client s3Client(ArchiveProperties props) {
        ArchiveProperties.Storage storage = props.getStorage();
        log.info("Configuring S3 client: endpoint={}, region={}, bucket={}",
                storage.getEndpoint(), storage.getRegion(), storage.getBucket());

        return S3Client.builder()
                .endpointOverride(URI.create(storage.getEndpoint()))
                .region(Region.of(storage.getRegion()))
                .credentialsProvider(credentials(storage))
                .serviceConfiguration(serviceConfiguration(storage))
                .build();
    }

    @Bean(destroyMethod = "close")
    public S3Presigner s3Presigner(ArchiveProperties props) {
        ArchiveProperties.Storage storage = props.getStorage();
        return S3Presigner.builder()
                .endpointOverride(URI.create(storage.getEndpoint()))
                .region(Region.of(storage.getRegion()))
                .credentialsProvider(credentials(storage))
                .serviceConfiguration(serviceConfiguration(storage))
                .build();
    }

    private AwsCredentialsProvider credentials(ArchiveProperties.Storage storage) {
        if (storage.getAccessKey() == null || storage.getAccessKey().isBlank()) {
            return DefaultCredentialsProvider.create();
        }
        return StaticCredentialsProvider.create(
                AwsBasicCredentials.create(storage.getAccessKey(), storage.getSecretKey()));
    }

    private S3Configuration serviceConfiguration(ArchiveProperties.Storage storage) {
        return S3Configuration.builder()
                .pathStyleAccessEnabled(storage.isPathStyleAccess())
                .build();
    }
}
