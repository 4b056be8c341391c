package io.github.hide212131.langchain4j.agent.runtime.session;

import io.github.hide212131.langchain4j.agent.runtime.AgentConfigurationException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Expands input-file specs into concrete paths. Specs containing glob characters are matched against files below
 * the base directory; other specs are taken literally. The result is de-duplicated in first-seen order.
 */
public final class InputFileResolver {

    private static final Pattern GLOB_CHARS = Pattern.compile("[*?\\[]");

    private final Path baseDirectory;

    public InputFileResolver(Path baseDirectory) {
        this.baseDirectory = Objects.requireNonNull(baseDirectory, "baseDirectory").toAbsolutePath().normalize();
    }

    public static boolean isGlob(String spec) {
        return GLOB_CHARS.matcher(spec).find();
    }

    public List<Path> resolve(List<String> specs) {
        Set<Path> resolved = new LinkedHashSet<>();
        for (String spec : specs) {
            if (isGlob(spec)) {
                List<Path> matches = expand(spec);
                if (matches.isEmpty()) {
                    throw new AgentConfigurationException("Input file pattern matched no files: " + spec);
                }
                resolved.addAll(matches);
            } else {
                resolved.add(baseDirectory.resolve(spec).normalize());
            }
        }
        return List.copyOf(resolved);
    }

    private List<Path> expand(String pattern) {
        String normalized = pattern.replace('\\', '/');
        String absolutePattern = normalized.startsWith("/")
                ? normalized
                : baseDirectory.toString().replace('\\', '/') + "/" + normalized;
        PathMatcher matcher = baseDirectory.getFileSystem().getPathMatcher("glob:" + absolutePattern);
        Path walkRoot = literalPrefix(absolutePattern);
        if (!Files.isDirectory(walkRoot)) {
            return List.of();
        }
        List<Path> matches = new ArrayList<>();
        try (Stream<Path> files = Files.walk(walkRoot)) {
            files.filter(Files::isRegularFile)
                    .map(path -> path.toAbsolutePath().normalize())
                    .filter(matcher::matches)
                    .sorted()
                    .forEach(matches::add);
        } catch (IOException ex) {
            throw new AgentConfigurationException("Failed to expand input file pattern: " + pattern, ex);
        }
        return matches;
    }

    private static Path literalPrefix(String absolutePattern) {
        int firstGlob = GLOB_CHARS.matcher(absolutePattern).results().findFirst().map(r -> r.start()).orElseThrow();
        int lastSeparator = absolutePattern.lastIndexOf('/', firstGlob);
        String prefix = lastSeparator <= 0 ? "/" : absolutePattern.substring(0, lastSeparator);
        return Path.of(prefix);
    }
}
