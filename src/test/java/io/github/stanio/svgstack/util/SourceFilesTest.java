/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgstack.util;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SourceFilesTest {

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() throws IOException {
        for (String name : List.of("fig10.svg", "fig02.svg", "fig01.svg", "notes.txt")) {
            Files.createFile(tempDir.resolve(name));
        }
        Files.createDirectory(tempDir.resolve("fig03.svg"));
    }

    @Test
    void globSortedByName() throws Exception {
        List<Path> files = SourceFiles.expand(List.of(tempDir + "/fig*.svg"));

        assertThat(files).containsExactly(tempDir.resolve("fig01.svg"),
                                          tempDir.resolve("fig02.svg"),
                                          tempDir.resolve("fig10.svg"));
    }

    @Test
    void argumentOrderKept() throws Exception {
        List<Path> files = SourceFiles.expand(List.of(tempDir + "/fig1?.svg",
                                                      "plain.svg",
                                                      tempDir + "/fig0{1,2}.svg"));

        assertThat(files).containsExactly(tempDir.resolve("fig10.svg"),
                                          Path.of("plain.svg"),
                                          tempDir.resolve("fig01.svg"),
                                          tempDir.resolve("fig02.svg"));
    }

    @Test
    void noMatches() throws Exception {
        assertThat(SourceFiles.expand(List.of(tempDir + "/*.png"))).isEmpty();
        assertThat(SourceFiles.expand(List.of(tempDir + "/missing/*.svg"))).isEmpty();
    }

    @Test
    void isGlob() {
        assertThat(SourceFiles.isGlob("*.svg")).isTrue();
        assertThat(SourceFiles.isGlob("fig[0-9].svg")).isTrue();
        assertThat(SourceFiles.isGlob("fig.svg")).isFalse();
    }

}
