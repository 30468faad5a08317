package com.vidnyan.rva.domain.model;

/**
 * Source code location.
 */
public record Location(
    String filePath,
    int line,
    int column
) {

    public static Location at(String filePath, int line, int column) {
        return new Location(filePath, line, column);
    }

    public static Location unknown(String filePath) {
        return new Location(filePath, 0, 0);
    }

    /**
     * Format as readable string.
     */
    public String format() {
        return filePath + ":" + line + ":" + column;
    }
}
