package com.docassets.util;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Utility class for file name and path string manipulation.
 */
public class FileUtils {

    private FileUtils() {
    }

    /**
     * Extracts the file extension from a file name.
     *
     * @param fileName The file name (e.g., "image.jpg").
     * @return The extension (lowercase, without dot), or an empty string if none found.
     */
    public static String getExtension(String fileName) {
        if (fileName == null) {
            return "";
        }
        String name = getFileName(fileName);
        int i = name.lastIndexOf('.');
        // ".gitignore" (i == 0) has no extension
        if (i > 0) {
            return name.substring(i + 1).toLowerCase();
        }
        return "";
    }

    /**
     * Returns the extension including its dot, in its original case ("Logo.PNG" -> ".PNG").
     */
    public static String getDottedExtension(String fileName) {
        if (fileName == null) {
            return "";
        }
        String name = getFileName(fileName);
        int i = name.lastIndexOf('.');
        if (i > 0) {
            return name.substring(i);
        }
        return "";
    }

    /**
     * Returns the file name without directory and without extension ("a/b/logo.png" -> "logo").
     */
    public static String getBaseName(String fileName) {
        if (fileName == null) {
            return "";
        }
        String name = getFileName(fileName);
        String ext = getDottedExtension(name);
        return name.substring(0, name.length() - ext.length());
    }

    /**
     * Returns the last segment of a '/' or '\' separated path.
     */
    public static String getFileName(String path) {
        if (path == null) {
            return "";
        }
        String normalized = toForwardSlashes(path);
        int i = normalized.lastIndexOf('/');
        return i >= 0 ? normalized.substring(i + 1) : normalized;
    }

    public static String toForwardSlashes(String path) {
        return path == null ? null : path.replace('\\', '/');
    }

    /**
     * Joins path segments with single '/' separators, ignoring empty segments.
     */
    public static String joinUrlPath(String... segments) {
        StringBuilder sb = new StringBuilder();
        for (String segment : segments) {
            if (segment == null || segment.isEmpty()) continue;
            String trimmed = trimSlashes(toForwardSlashes(segment));
            if (trimmed.isEmpty()) continue;
            sb.append('/').append(trimmed);
        }
        return sb.length() == 0 ? "/" : sb.toString();
    }

    private static String trimSlashes(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '/') start++;
        while (end > start && value.charAt(end - 1) == '/') end--;
        return value.substring(start, end);
    }

    /**
     * Lowercase hex encoding of a byte array.
     */
    public static String toHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }

    /**
     * SHA-256 of the given bytes as 64 lowercase hex characters.
     */
    public static String sha256Hex(byte[] content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return toHex(digest.digest(content));
        } catch (NoSuchAlgorithmException e) {
            // Every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
