/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgstack;

import static io.github.stanio.svgstack.TestSources.NS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.xmlunit.assertj3.XmlAssert;

import com.google.gson.JsonParseException;

import io.github.stanio.svgstack.SVGStackTool.ArgumentException;
import io.github.stanio.svgstack.SVGStackTool.CommandArgs;
import io.github.stanio.svgstack.svg.ImageExport;
import io.github.stanio.svgstack.svg.SVGNamespaces;
import io.github.stanio.svgstack.svg.SVGOutput;

class SVGStackToolTest {

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() throws IOException {
        writeSVG("a.svg", 100, 100, "");
        writeSVG("b.svg", 40, 20, "");
    }

    private void writeSVG(String name, int width, int height, String content)
            throws IOException {
        Files.writeString(tempDir.resolve(name),
                "<svg xmlns=\"" + SVGNamespaces.SVG + "\""
                + " xmlns:xlink=\"" + SVGNamespaces.XLINK + "\""
                + " width=\"" + width + "\" height=\"" + height + "\">"
                + content + "</svg>");
    }

    private String file(String name) {
        return tempDir.resolve(name).toString();
    }

    @Test
    void defaultArgs() {
        CommandArgs cmdArgs = new CommandArgs("a.svg", "b.svg");

        assertThat(cmdArgs.direction).isEqualTo(Direction.TOP_TO_BOTTOM);
        assertThat(cmdArgs.alignment).isEqualTo(Alignment.CENTER);
        assertThat(cmdArgs.spacing).isZero();
        assertThat(cmdArgs.margin).isZero();
        assertThat(cmdArgs.outFile).isNull();
        assertThat(cmdArgs.exportImages).isNull();
        assertThat(cmdArgs.debugBoxes).isFalse();
        assertThat(cmdArgs.files).containsExactly("a.svg", "b.svg");
    }

    @Test
    void allOptions() {
        CommandArgs cmdArgs = new CommandArgs("--direction=h", "--spacing", "1in",
                "--margin=2mm", "--align=top", "--outfile=out.svg",
                "--export-images=fig%02d", "--debug-boxes", "a.svg");

        assertThat(cmdArgs.direction).isEqualTo(Direction.LEFT_TO_RIGHT);
        assertThat(cmdArgs.spacing).isEqualTo(96);
        assertThat(cmdArgs.margin).isCloseTo(2 * 96 / 25.4, within(1e-9));
        assertThat(cmdArgs.alignment).isEqualTo(Alignment.TOP);
        assertThat(cmdArgs.outFile).isEqualTo(Path.of("out.svg"));
        assertThat(cmdArgs.exportImages).isEqualTo("fig%02d");
        assertThat(cmdArgs.debugBoxes).isTrue();
        assertThat(cmdArgs.files).containsExactly("a.svg");
    }

    @Test
    void exportImagesDefaultPattern() {
        CommandArgs cmdArgs = new CommandArgs("--export-images", "a.svg");

        assertThat(cmdArgs.exportImages).isEqualTo(ImageExport.DEFAULT_NAME_PATTERN);
        assertThat(cmdArgs.files).containsExactly("a.svg");
    }

    @Test
    void help() {
        assertThat(new CommandArgs("-h").help).isTrue();
        assertThat(new CommandArgs("a.svg", "--help").help).isTrue();
    }

    @Test
    void usageErrors() {
        assertThatThrownBy(() -> new CommandArgs())
                .as("no files")
                .isInstanceOf(ArgumentException.class)
                .extracting("status").isEqualTo(SVGStackTool.STATUS_USAGE);
        assertThatThrownBy(() -> new CommandArgs("--frobnicate", "a.svg"))
                .as("unknown option")
                .isInstanceOf(ArgumentException.class)
                .hasMessage("Unknown option: --frobnicate");
        assertThatThrownBy(() -> new CommandArgs("--layout=l.json", "a.svg"))
                .as("files and layout")
                .isInstanceOf(ArgumentException.class)
                .extracting("status").isEqualTo(SVGStackTool.STATUS_USAGE);
        assertThatThrownBy(() -> new CommandArgs("a.svg", "--outfile"))
                .as("missing value")
                .isInstanceOf(ArgumentException.class)
                .hasMessage("--outfile requires an argument");
    }

    @Test
    void argumentErrors() {
        assertThatThrownBy(() -> new CommandArgs("--direction=diagonal", "a.svg"))
                .isInstanceOf(ArgumentException.class)
                .extracting("status").isEqualTo(SVGStackTool.STATUS_ARGUMENT);
        assertThatThrownBy(() -> new CommandArgs("--spacing=5em", "a.svg"))
                .isInstanceOf(ArgumentException.class)
                .extracting("status").isEqualTo(SVGStackTool.STATUS_ARGUMENT);
        assertThatThrownBy(() -> new CommandArgs("--margin=-1", "a.svg"))
                .isInstanceOf(ArgumentException.class)
                .extracting("status").isEqualTo(SVGStackTool.STATUS_ARGUMENT);
    }

    @Test
    void invalidOutputPath() {
        assertThatThrownBy(() -> new CommandArgs("--outfile=out\0.svg", "a.svg"))
                .isInstanceOf(ArgumentException.class)
                .extracting("status").isEqualTo(SVGStackTool.STATUS_ARGUMENT);
    }

    @Test
    void errorMessages() {
        assertThat(SVGStackTool.errorMessage(new ArgumentException(SVGStackTool.STATUS_USAGE,
                                                                   "Specify source files")))
                .isEqualTo("Error: Specify source files");

        IOException cause = new IOException("disk full");
        assertThat(SVGStackTool.errorMessage(new CompositionException("can't save", cause)))
                .isEqualTo("Error: Composition: can't save"
                           + System.lineSeparator() + "Caused by: IO: disk full");

        RuntimeException repeated = new RuntimeException("Unknown direction: x");
        assertThat(SVGStackTool.errorMessage(new JsonParseException(
                        repeated.getMessage(), repeated)))
                .isEqualTo("Error: JsonParse: Unknown direction: x");
    }

    @Test
    void negativeSourceSize() throws Exception {
        Files.writeString(tempDir.resolve("negative.svg"),
                "<svg xmlns=\"" + SVGNamespaces.SVG + "\" width=\"-50\" height=\"20\"/>");

        assertThatThrownBy(() -> SVGStackTool.run(new CommandArgs("--direction=h",
                        file("negative.svg"), file("b.svg")), new ByteArrayOutputStream()))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("negative.svg")
                .hasMessageContaining("width=\"-50\"");
    }

    @Test
    void composeToStandardOutput() throws Exception {
        ByteArrayOutputStream stdout = new ByteArrayOutputStream();

        SVGStackTool.run(new CommandArgs("--direction=h", "--spacing=10",
                                         file("a.svg"), file("b.svg")), stdout);

        String text = stdout.toString(StandardCharsets.UTF_8);
        assertThat(text).startsWith(SVGOutput.HEADER);
        XmlAssert.assertThat(text).withNamespaceContext(NS)
                .valueByXPath("/svg:svg/@width").isEqualTo("150");
        XmlAssert.assertThat(text).withNamespaceContext(NS)
                .valueByXPath("/svg:svg/@height").isEqualTo("100");
        XmlAssert.assertThat(text).withNamespaceContext(NS)
                .valueByXPath("/svg:svg/svg:g[@id='id1']/@transform")
                .as("centered").isEqualTo("translate(110,40)");
    }

    @Test
    void composeGlobToFile() throws Exception {
        ByteArrayOutputStream stdout = new ByteArrayOutputStream();
        Path outFile = tempDir.resolve("out").resolve("stack.svg");
        Files.createDirectory(outFile.getParent());

        SVGStackTool.run(new CommandArgs("--margin=5", "--outfile=" + outFile,
                                         tempDir + "/*.svg"), stdout);

        assertThat(stdout.size()).isZero();
        XmlAssert.assertThat(Files.readString(outFile)).withNamespaceContext(NS)
                .valueByXPath("/svg:svg/@height").isEqualTo("130");
        XmlAssert.assertThat(Files.readString(outFile)).withNamespaceContext(NS)
                .nodesByXPath("/svg:svg/svg:g").hasSize(2);
    }

    @Test
    void exportImagesNextToOutput() throws Exception {
        writeSVG("pic.svg", 10, 10, "<image width=\"10\" height=\"10\" xlink:href=\"data:image/png;base64,"
                                    + Base64.getEncoder().encodeToString(new byte[] { 1, 2, 3 })
                                    + "\" />");
        Path outFile = tempDir.resolve("pic-stack.svg");

        SVGStackTool.run(new CommandArgs("--export-images", "--outfile=" + outFile,
                                         file("pic.svg")), new ByteArrayOutputStream());

        assertThat(tempDir.resolve("image001.png")).hasBinaryContent(new byte[] { 1, 2, 3 });
        XmlAssert.assertThat(Files.readString(outFile)).withNamespaceContext(NS)
                .valueByXPath("//svg:image/@xlink:href").isEqualTo("image001.png");
    }

    @Test
    void layoutFile() throws Exception {
        Files.writeString(tempDir.resolve("layout.json"),
                "{ \"direction\": \"h\", \"items\": ["
                + " { \"file\": \"a.svg\" }, { \"file\": \"b.svg\", \"align\": \"bottom\" } ] }");
        ByteArrayOutputStream stdout = new ByteArrayOutputStream();

        SVGStackTool.run(new CommandArgs("--layout", file("layout.json")), stdout);

        String text = stdout.toString(StandardCharsets.UTF_8);
        XmlAssert.assertThat(text).withNamespaceContext(NS)
                .valueByXPath("/svg:svg/@width").isEqualTo("140");
        XmlAssert.assertThat(text).withNamespaceContext(NS)
                .valueByXPath("/svg:svg/svg:g[@id='id1']/@transform")
                .isEqualTo("translate(100,80)");
    }

    @Test
    void noMatchingFiles() {
        assertThatThrownBy(() -> SVGStackTool.run(new CommandArgs(tempDir + "/*.png"),
                                                  new ByteArrayOutputStream()))
                .isInstanceOf(IOException.class)
                .hasMessageStartingWith("No files match");
    }

    @Test
    void helpText() {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        SVGStackTool.printHelp(new PrintStream(buf, true, StandardCharsets.UTF_8));

        assertThat(buf.toString(StandardCharsets.UTF_8))
                .startsWith("USAGE: svgstack")
                .contains("--direction", "--spacing", "--margin", "--align",
                          "--layout", "--outfile", "--export-images", "--debug-boxes")
                .contains("margin around the items, not between them")
                .contains("use --spacing");
    }

}
