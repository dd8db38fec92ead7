package kaspi.lab.archiveService.service;

@FunctionalInterface
public interface CompressionPolicy {
    boolean shouldCompress(String contentType);
}
