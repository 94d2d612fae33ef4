package io.repoinsight.learning;

/**
 * Where a finding was reported. Line is 1-based; 0 means "whole file".
 */
public record SourceLocation(String filePath, int line) {

    public SourceLocation {
        if (filePath == null) {
            filePath = "";
        }
        if (line < 0) {
            throw new IllegalArgumentException("line cannot be negative: " + line);
        }
    }

    public String formatted() {
        return line > 0 ? filePath + ":" + line : filePath;
    }
}
