package de.upb.sse.jrefactor.parse;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives the source root of a file from its package declaration, e.g. {@code /p/src/main/java}
 * for {@code /p/src/main/java/com/foo/A.java} declaring {@code package com.foo;}.
 */
public class SourceRootFinder {
    private final static String PACKAGE_REGEX = "package\\s+([\\d|\\w|.]+)\\s*;";
    private final static Pattern PACKAGE_PATTERN = Pattern.compile(PACKAGE_REGEX);

    /**
     * The declared package of a source text, or the empty string for the default package.
     */
    public static String findPackage(String source) {
        String packageDec = findPackageLine(source);
        if (packageDec == null) return "";

        Matcher m = PACKAGE_PATTERN.matcher(packageDec);
        if (!m.find() || m.group(1) == null) return "";
        return m.group(1);
    }

    /**
     * The directory the package path of {@code javaFile} starts in, or null when the file does not
     * sit in a directory matching its package.
     */
    public static Path findSourceRoot(Path javaFile, String packageName) {
        Path dir = javaFile.toAbsolutePath().normalize().getParent();
        if (dir == null) return null;
        if (packageName == null || packageName.isEmpty()) return dir;

        String[] segments = packageName.split("\\.");
        for (int i = segments.length - 1; i >= 0; i--) {
            if (dir == null || dir.getFileName() == null || !dir.getFileName().toString().equals(segments[i])) {
                return null;
            }
            dir = dir.getParent();
        }
        return dir;
    }

    private static String findPackageLine(String source) {
        boolean commentScope = false;
        try (BufferedReader reader = new BufferedReader(new StringReader(source))) {
            String line;
            while ((line = reader.readLine()) != null) {
                String trimmedLine = line.trim();

                if (!commentScope && trimmedLine.startsWith("package")) return trimmedLine;
                if (trimmedLine.startsWith("/*")) commentScope = true;
                if (!commentScope && !trimmedLine.startsWith("//") && !trimmedLine.startsWith("@") && !trimmedLine.isEmpty()) {
                    break;
                }

                if (commentScope) {
                    int closeCommentIndex = trimmedLine.indexOf("*/");
                    int openCommentIndex = trimmedLine.lastIndexOf("/*");
                    if (closeCommentIndex > -1 && openCommentIndex < closeCommentIndex) commentScope = false;
                }
            }
            return null;
        } catch (IOException e) {
            // reading from a string never fails
            throw new IllegalStateException(e);
        }
    }
}
