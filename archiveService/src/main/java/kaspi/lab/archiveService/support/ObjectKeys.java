package kaspi.lab.archiveService.support;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Keys look like {@code {prefix}/{base64url(ownerId)}/{uuid}/{safeName}}. A fresh uuid per upload keeps
 * objects apart even when two names sanitize to the same text.
 */
public final class ObjectKeys {

    private static final int MAX_NAME_LENGTH = 200;
    private static final Pattern UPLOAD_SUFFIX = Pattern.compile(
            "[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}/[a-zA-Z0-9._-]+");

    private ObjectKeys() {
    }

    public static String newKey(String prefix, String ownerId, String filename) {
        return ownerPrefix(prefix, ownerId) + UUID.randomUUID() + "/" + safeName(filename);
    }

    public static boolean isOwnedBy(String prefix, String ownerId, String key) {
        if (key == null || ownerId == null || ownerId.isEmpty()) return false;
        String ownerPrefix = ownerPrefix(prefix, ownerId);
        return key.startsWith(ownerPrefix)
                && UPLOAD_SUFFIX.matcher(key.substring(ownerPrefix.length())).matches();
    }

    static String ownerPrefix(String prefix, String ownerId) {
        return prefix + "/" + ownerSegment(ownerId) + "/";
    }

    static String ownerSegment(String ownerId) {
        return Base64.getUrlEncoder().withoutPadding()
                .encodeToString(ownerId.getBytes(StandardCharsets.UTF_8));
    }

    static String safeName(String s) {
        if (s == null || s.isBlank()) return "unnamed";
        String base = s.trim().replaceAll("[/\\\\]+", "_").replaceAll("[^a-zA-Z0-9._-]", "_");
        if (base.matches("\\.+")) {
            base = "unnamed";
        }
        return base.length() > MAX_NAME_LENGTH ? base.substring(0, MAX_NAME_LENGTH) : base;
    }
}
