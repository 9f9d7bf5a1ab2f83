package tokenmerge;

import java.util.Locale;

/**
 * On-disk formats for merge rules.
 */
public enum MergesFormat {

    /**
     * Jackson-serialized {@link MergesDocument}.
     */
    JSON,

    /**
     * Plain {@code merges.txt}: one space-separated pair per line.
     */
    TEXT;

    /**
     * Returns the default format, used when none is given.
     *
     * @return {@link #JSON}
     */
    public static MergesFormat defaultFormat() {
        return JSON;
    }

    /**
     * Returns the lowercase string form of this format.
     *
     * @return e.g. {@code "json"}
     */
    public String asStr() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a format name, case-insensitive. {@code "txt"} is accepted for {@link #TEXT}.
     *
     * @param value the name
     * @return the format
     * @throws IllegalArgumentException if {@code value} is {@code null} or unknown
     */
    public static MergesFormat fromStr(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Format string cannot be null");
        }
        final String v = value.trim().toUpperCase(Locale.ROOT);
        if ("TXT".equals(v)) return TEXT;
        return MergesFormat.valueOf(v);
    }

    /**
     * Infers the format from a file name: {@code .json} is JSON, anything else text.
     *
     * @param fileName the file name or path
     * @return the inferred format
     */
    public static MergesFormat fromFileName(String fileName) {
        return fileName != null && fileName.toLowerCase(Locale.ROOT).endsWith(".json") ? JSON : TEXT;
    }
}
