package mirror;

import java.nio.file.Path;

// What MirrorStore wrote for one URL.
public record MirroredPage(String url, Path localPath, byte[] content) { }
