package kaspi.lab.archiveService.service.impl;

import kaspi.lab.archiveService.config.ArchiveProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DenylistCompressionPolicyTest {

    private final DenylistCompressionPolicy policy = new DenylistCompressionPolicy(new ArchiveProperties());

    @ParameterizedTest
    @ValueSource(strings = {"application/zip", "image/JPEG", "video/mp4", "image/png; foo=bar"})
    void alreadyCompressedTypesAreStoredAsIs(String contentType) {
        assertFalse(policy.shouldCompress(contentType));
    }

    @ParameterizedTest
    @ValueSource(strings = {"text/plain", "text/csv; charset=utf-8", "application/json", "application/octet-stream"})
    void otherTypesAreCompressed(String contentType) {
        assertTrue(policy.shouldCompress(contentType));
    }

    @Test
    void denylistComesFromConfiguration() {
        ArchiveProperties props = new ArchiveProperties();
        props.getCompression().setDenylist(List.of("Text/Plain"));
        DenylistCompressionPolicy custom = new DenylistCompressionPolicy(props);

        assertFalse(custom.shouldCompress("text/plain"));
        assertTrue(custom.shouldCompress("image/png"));
    }
}
