package com.auditsift.core.io;

import com.auditsift.core.api.IFileDiscovery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/** 파일 이름 glob 매칭으로 덤프 파일을 찾는다 (정렬된 절대경로). */
public final class GlobFileDiscovery implements IFileDiscovery {

    private static final Logger LOG = LoggerFactory.getLogger(GlobFileDiscovery.class);

    @Override
    public List<Path> discover(Path basePath, String pattern, boolean recursive) throws IOException {
        if (!Files.isDirectory(basePath)) throw new NotDirectoryException(String.valueOf(basePath));
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + pattern);

        try (Stream<Path> s = recursive ? Files.walk(basePath) : Files.list(basePath)) {
            List<Path> files = s.filter(Files::isRegularFile)
                    .filter(p -> matcher.matches(p.getFileName()))
                    .map(Path::toAbsolutePath)
                    .sorted()
                    .collect(Collectors.toList());
            LOG.debug("Discovered {} files matching '{}' under {} (recursive={})",
                    files.size(), pattern, basePath, recursive);
            return files;
        }
    }
}
