package io.github.hide212131.langchain4j.agent.runtime.execution;

public record SavedFile(String sourcePath, String outputPath, long size) {
}
