package io.github.hide212131.langchain4j.agent.runtime.execution;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Objects;

/** Temporary host directory backing an execution environment. Relative paths must stay inside it. */
final class Workspace {

    private final Path root;

    private Workspace(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    static Workspace createTemporary(String prefix) {
        try {
            return new Workspace(Files.createTempDirectory(prefix));
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to create workspace directory", ex);
        }
    }

    Path root() {
        return root;
    }

    /**
     * Resolves an environment path. Relative paths resolve against the root; absolute paths are accepted only
     * when they already point inside it.
     */
    Path resolve(String path) {
        Objects.requireNonNull(path, "path");
        Path candidate = Path.of(path.replace('\\', '/'));
        Path resolved = (candidate.isAbsolute() ? candidate : root.resolve(candidate)).normalize();
        if (!resolved.startsWith(root)) {
            throw new IllegalArgumentException("Path is outside the workspace: " + path);
        }
        return resolved;
    }

    byte[] read(String path) {
        Path file = resolve(path);
        if (!Files.isRegularFile(file)) {
            throw new IllegalArgumentException("File not found: " + path);
        }
        try {
            return Files.readAllBytes(file);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read file: " + path, ex);
        }
    }

    void write(String path, byte[] content) {
        Path file = resolve(path);
        try {
            Path parent = file.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(file, content);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to write file: " + path, ex);
        }
    }

    void delete() {
        if (!Files.exists(root)) {
            return;
        }
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                    Files.deleteIfExists(file);
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                    Files.deleteIfExists(dir);
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to delete workspace directory: " + root, ex);
        }
    }
}
