package kaspi.lab.archiveService.support;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public final class TagNormalizer {

    private TagNormalizer() {
    }

    public static List<String> normalize(Collection<String> rawTags) {
        if (rawTags == null || rawTags.isEmpty()) {
            return List.of();
        }
        Set<String> normalized = new LinkedHashSet<>();
        for (String raw : rawTags) {
            if (raw == null) {
                continue;
            }
            for (String piece : raw.split(",")) {
                String tag = piece.trim().toLowerCase(Locale.ROOT);
                if (!tag.isEmpty()) {
                    normalized.add(tag);
                }
            }
        }
        return List.copyOf(normalized);
    }
}
