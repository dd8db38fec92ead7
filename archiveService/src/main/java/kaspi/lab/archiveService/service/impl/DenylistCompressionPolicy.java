package kaspi.lab.archiveService.service.impl;

import kaspi.lab.archiveService.config.ArchiveProperties;
import kaspi.lab.archiveService.service.CompressionPolicy;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

@Component
public class DenylistCompressionPolicy implements CompressionPolicy {

    private final Set<String> denylist;

    public DenylistCompressionPolicy(ArchiveProperties props) {
        this.denylist = props.getCompression().getDenylist().stream()
                .map(DenylistCompressionPolicy::baseType)
                .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public boolean shouldCompress(String contentType) {
        return !denylist.contains(baseType(contentType));
    }

    // "text/plain; charset=utf-8" -> "text/plain"
    static String baseType(String contentType) {
        if (contentType == null) {
            return "";
        }
        int semicolon = contentType.indexOf(';');
        String base = semicolon >= 0 ? contentType.substring(0, semicolon) : contentType;
        return base.trim().toLowerCase(Locale.ROOT);
    }
}
