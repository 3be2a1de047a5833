package org.ppvariant.compiler.frontend.io;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Collectors;

/**
 * Loads source files for variant analysis from the local filesystem or, with a
 * {@code classpath:} prefix, from classpath resources.
 */
public final class SourceLoader {

    /** Prefix that selects a classpath resource instead of a file. */
    public static final String CLASSPATH_PREFIX = "classpath:";

    /**
     * Result of loading a source file.
     *
     * @param content     The file content (line endings normalized to {@code \n}).
     * @param logicalName The name recorded in tokens and diagnostics.
     */
    public record LoadResult(String content, String logicalName) {}

    private SourceLoader() {}

    /**
     * Loads a source from a path or a {@code classpath:} location.
     *
     * @param location The file path or classpath location.
     * @return The loaded content.
     * @throws IOException If the source cannot be found or read.
     */
    public static LoadResult load(String location) throws IOException {
        if (location.startsWith(CLASSPATH_PREFIX)) {
            return loadClasspath(location.substring(CLASSPATH_PREFIX.length()));
        }
        return loadFile(Path.of(location).toAbsolutePath().normalize());
    }

    /**
     * Loads content from a local filesystem path.
     *
     * @param resolvedPath The fully resolved, normalized path.
     * @return The loaded content and the normalized path as logical name.
     * @throws IOException If the file cannot be read.
     */
    public static LoadResult loadFile(Path resolvedPath) throws IOException {
        String logicalName = resolvedPath.toString().replace('\\', '/');
        String content = normalizeLineEndings(Files.readString(resolvedPath, StandardCharsets.UTF_8));
        return new LoadResult(content, logicalName);
    }

    /**
     * Loads content from a classpath resource.
     *
     * @param resourcePath The classpath resource path.
     * @return The loaded content and the resource path as logical name.
     * @throws IOException If the resource is not found or cannot be read.
     */
    public static LoadResult loadClasspath(String resourcePath) throws IOException {
        try (InputStream is = Thread.currentThread().getContextClassLoader().getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new IOException("Resource not found in classpath: " + resourcePath);
            }
            try (BufferedReader br = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8))) {
                String content = br.lines().collect(Collectors.joining("\n")) + "\n";
                return new LoadResult(content, resourcePath);
            }
        }
    }

    private static String normalizeLineEndings(String text) {
        return text.replace("\r\n", "\n").replace("\r", "\n");
    }
}
