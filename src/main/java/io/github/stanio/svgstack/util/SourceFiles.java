/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgstack.util;

import java.io.File;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Expands file name arguments containing glob patterns, for shells that
 * don't.  Only the file name part is matched against the pattern:
 * <pre>
 * <code>figures/panel-*.svg</code></pre>
 *
 * @see  java.nio.file.FileSystem#getPathMatcher(String)
 */
public final class SourceFiles {

    static final Logger log = Logger.getLogger(SourceFiles.class.getName());

    private static final Pattern GLOB_CHARS = Pattern.compile("[*?\\[{]");

    private SourceFiles() {/* no instances */}

    static boolean isGlob(String fileName) {
        return GLOB_CHARS.matcher(fileName).find();
    }

    /**
     * Expands the given arguments in order.  Matches of a single pattern are
     * sorted by file name.  Patterns matching no files expand to nothing;
     * arguments without glob characters are passed through as they are,
     * existing or not.
     *
     * @param   args  file names or glob patterns
     * @return  the expanded list of files
     * @throws  IOException  if listing a pattern's directory fails
     */
    public static List<Path> expand(Collection<String> args) throws IOException {
        List<Path> files = new ArrayList<>();
        for (String item : args) {
            int slash = Math.max(item.lastIndexOf('/'),
                                 item.lastIndexOf(File.separatorChar));
            String fileName = item.substring(slash + 1);
            if (!isGlob(fileName)) {
                files.add(Path.of(item));
                continue;
            }

            Path dir = (slash < 0) ? Path.of("") : Path.of(item.substring(0, slash + 1));
            List<Path> matches = new ArrayList<>();
            if (Files.isDirectory(dir.toAbsolutePath())) {
                try (DirectoryStream<Path> list =
                        Files.newDirectoryStream(dir.toAbsolutePath(), fileName)) {
                    for (Path entry : list) {
                        if (Files.isRegularFile(entry)) {
                            matches.add(dir.resolve(entry.getFileName()));
                        }
                    }
                }
            }
            matches.sort((a, b) -> a.getFileName().toString()
                                    .compareTo(b.getFileName().toString()));
            log.fine(() -> item + " matches " + matches.size() + " file(s)");
            files.addAll(matches);
        }
        return files;
    }

}
