package com.linkscout.core.sink;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * {@code --save-images} 대상 디렉터리. 파일명은 URL 경로의 마지막 세그먼트,
 * 이미 쓴 이름과 겹치면 {@code name-1.ext}, {@code name-2.ext} ...
 */
public final class ImageStore {
    private static final Logger LOG = LoggerFactory.getLogger(ImageStore.class);
    private static final String FALLBACK_NAME = "image";

    private final Path dir;
    private final Set<String> used = new HashSet<>();

    public ImageStore(Path dir) {
        this.dir = Objects.requireNonNull(dir, "dir");
    }

    public synchronized Path save(String url, byte[] bytes) throws IOException {
        Files.createDirectories(dir);
        String name = uniqueName(fileNameOf(url));
        Path out = dir.resolve(name);
        Files.write(out, bytes, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        LOG.debug("Saved {} -> {}", url, out);
        return out;
    }

    static String fileNameOf(String url) {
        String path;
        try {
            path = URI.create(url).getPath();
        } catch (IllegalArgumentException e) {
            return FALLBACK_NAME;
        }
        if (path == null || path.isEmpty() || path.endsWith("/")) return FALLBACK_NAME;
        String last = path.substring(path.lastIndexOf('/') + 1);
        String safe = last.replaceAll("[^A-Za-z0-9._-]", "_");
        return (safe.isEmpty() || safe.equals(".") || safe.equals("..")) ? FALLBACK_NAME : safe;
    }

    private String uniqueName(String name) {
        if (used.add(name) && !Files.exists(dir.resolve(name))) return name;
        int dot = name.lastIndexOf('.');
        String stem = (dot > 0) ? name.substring(0, dot) : name;
        String ext = (dot > 0) ? name.substring(dot) : "";
        for (int i = 1; ; i++) {
            String candidate = stem + "-" + i + ext;
            if (used.add(candidate) && !Files.exists(dir.resolve(candidate))) return candidate;
        }
    }
}
