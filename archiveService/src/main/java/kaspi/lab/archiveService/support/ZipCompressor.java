package kaspi.lab.archiveService.support;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

public final class ZipCompressor {

    public static final String ZIP_CONTENT_TYPE = "application/zip";
    public static final String ZIP_EXTENSION = ".zip";

    private ZipCompressor() {
    }

    public static byte[] zip(String entryName, byte[] content) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(32, content.length / 2));
        try (ZipOutputStream zip = new ZipOutputStream(out)) {
            zip.putNextEntry(new ZipEntry(entryName));
            zip.write(content);
            zip.closeEntry();
        }
        return out.toByteArray();
    }
}
