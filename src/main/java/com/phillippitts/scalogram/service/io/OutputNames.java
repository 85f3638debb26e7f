package com.phillippitts.scalogram.service.io;

/**
 * Output naming shared by the PNG sink and figure titles.
 */
public final class OutputNames {

    private OutputNames() {
        // Utility class - prevent instantiation
    }

    /**
     * Identifier up to its first dot: {@code run1.v2.aaa} becomes {@code run1}. An identifier
     * starting with a dot is returned unchanged.
     *
     * @param identifier input identifier
     * @return stem used for titles and file names
     */
    public static String stem(String identifier) {
        int dot = identifier.indexOf('.');
        return dot <= 0 ? identifier : identifier.substring(0, dot);
    }

    /**
     * @param identifier input identifier
     * @return {@code stem + ".png"}
     */
    public static String pngFileName(String identifier) {
        return stem(identifier) + ".png";
    }
}
