/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgstack;

import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

import org.w3c.dom.Document;

import com.google.gson.JsonParseException;

import io.github.stanio.svgstack.options.LayoutConfig;
import io.github.stanio.svgstack.svg.ImageExport;
import io.github.stanio.svgstack.svg.SVGFormatException;
import io.github.stanio.svgstack.svg.SVGLength;
import io.github.stanio.svgstack.svg.SVGOutput;
import io.github.stanio.svgstack.svg.SVGSource;
import io.github.stanio.svgstack.util.SourceFiles;

/**
 * Command-line utility concatenating SVG files into a single SVG file.
 * <p>
 * <i>Usage:</i></p>
 * <pre>
 * java -jar svgstack.jar [<var>options</var>] <var>&lt;file></var>...</pre>
 * <p>
 * <i>Example:</i></p>
 * <pre>
 * java -jar svgstack.jar --direction=h --spacing=5mm --outfile=ab.svg a.svg b.svg</pre>
 * <p>
 * File arguments may contain glob patterns in the file name part, like
 * {@code figures/*.svg}.  A {@code --layout} description file allows for
 * nested layouts, and per-item stretch, alignment, and decorations.</p>
 *
 * @see  LayoutConfig
 */
public class SVGStackTool {

    static final Logger log = Logger.getLogger(SVGStackTool.class.getName());

    static final int STATUS_USAGE = 1;
    static final int STATUS_ARGUMENT = 2;
    static final int STATUS_ERROR = 3;

    static void printHelp(PrintStream out) {
        out.println("USAGE: svgstack [<options>] <file>...");
        out.println("       svgstack [<options>] --layout=<layout.json>");
        out.println();
        out.println("Options:");
        out.println("  --direction=<h|v|rtl|btt>   item flow direction (default: vertical)");
        out.println("  --spacing=<length>          space between items (default: 0)");
        out.println("  --margin=<length>           margin around the items, not between them"
                                                   + " (default: 0)");
        out.println("  --align=<flags>             left|right|hcenter|top|bottom|vcenter|center|fill"
                                                   + " (default: center)");
        out.println("  --layout=<file>             JSON layout description");
        out.println("  --outfile=<file>            output file (default: standard output)");
        out.println("  --export-images[=<pattern>] extract inline images (default pattern: "
                                                   + ImageExport.DEFAULT_NAME_PATTERN + ")");
        out.println("  --debug-boxes               outline layout boxes and items");
        out.println();
        out.println("<length> is a number with an optional px, pt, in, mm, or cm unit.");
        out.println();
        out.println("Note: --margin used to set the space between items; use --spacing for that.");
    }


    static class CommandArgs {
        Direction direction = Direction.TOP_TO_BOTTOM;
        double spacing;
        double margin;
        int alignment = Alignment.CENTER;
        Path layoutFile;
        Path outFile;
        String exportImages;
        boolean debugBoxes;
        boolean help;
        final List<String> files = new ArrayList<>();

        /**
         * @throws  ArgumentException  if the arguments are not valid
         */
        CommandArgs(String... args) {
            List<String> argList = new ArrayList<>(Arrays.asList(args));
            if (argList.contains("-h") || argList.contains("--help")) {
                help = true;
                return;
            }

            try {
                findOptionalArg(argList, "--direction")
                        .ifPresent(value -> direction = Direction.parse(value));
                findOptionalArg(argList, "--spacing")
                        .ifPresent(value -> spacing = pixels(value));
                findOptionalArg(argList, "--margin")
                        .ifPresent(value -> margin = pixels(value));
                findOptionalArg(argList, "--align")
                        .ifPresent(value -> alignment = Alignment.parse(value));
                findOptionalArg(argList, "--layout")
                        .ifPresent(value -> layoutFile = Path.of(value));
                findOptionalArg(argList, "--outfile")
                        .ifPresent(value -> outFile = Path.of(value));
            } catch (IllegalArgumentException e) {
                throw new ArgumentException(STATUS_ARGUMENT, e.getMessage(), e);
            }

            int exportIndex = indexOfOption(argList, "--export-images");
            if (exportIndex >= 0) {
                String item = argList.remove(exportIndex);
                String value = item.substring("--export-images".length());
                exportImages = value.startsWith("=") && value.length() > 1
                               ? value.substring(1)
                               : ImageExport.DEFAULT_NAME_PATTERN;
            }
            debugBoxes = argList.remove("--debug-boxes");

            for (String item : argList) {
                if (item.startsWith("--")) {
                    throw new ArgumentException(STATUS_USAGE, "Unknown option: " + item);
                }
            }
            files.addAll(argList);

            if (layoutFile == null && files.isEmpty()) {
                throw new ArgumentException(STATUS_USAGE, "Specify source files");
            } else if (layoutFile != null && !files.isEmpty()) {
                throw new ArgumentException(STATUS_USAGE,
                        "Source files given with --layout: " + String.join(" ", files));
            }
        }

        private static double pixels(String value) {
            double pixels;
            try {
                pixels = SVGLength.toPixels(value);
            } catch (SVGFormatException e) {
                throw new IllegalArgumentException(e.getMessage(), e);
            }
            if (pixels < 0) {
                throw new IllegalArgumentException("Negative length: " + value);
            }
            return pixels;
        }

        private static int indexOfOption(List<String> args, String option) {
            for (int i = 0, len = args.size(); i < len; i++) {
                String item = args.get(i);
                if (item.equals(option) || item.startsWith(option + "=")) {
                    return i;
                }
            }
            return -1;
        }

        private static Optional<String> findOptionalArg(List<String> args, String option) {
            int index = indexOfOption(args, option);
            if (index < 0)
                return Optional.empty();

            String item = args.remove(index);
            if (item.length() > option.length()) {
                return Optional.of(item.substring(option.length() + 1));
            }
            if (index < args.size() && !args.get(index).startsWith("--")) {
                return Optional.of(args.remove(index));
            }
            throw new ArgumentException(STATUS_USAGE, option + " requires an argument");
        }
    }


    static class ArgumentException extends RuntimeException {

        private static final long serialVersionUID = 4708361172950361852L;

        final int status;

        ArgumentException(int status, String message) {
            super(message);
            this.status = status;
        }

        ArgumentException(int status, String message, Throwable cause) {
            super(message, cause);
            this.status = status;
        }

    } // class ArgumentException


    static BoxLayout createLayout(CommandArgs cmdArgs)
            throws IOException, JsonParseException {
        if (cmdArgs.layoutFile != null) {
            return new LayoutConfig().load(cmdArgs.layoutFile);
        }

        List<Path> sourceFiles = SourceFiles.expand(cmdArgs.files);
        if (sourceFiles.isEmpty()) {
            throw new IOException("No files match: " + String.join(" ", cmdArgs.files));
        }

        BoxLayout layout = new BoxLayout(cmdArgs.direction);
        layout.setSpacing(cmdArgs.spacing);
        layout.setContentsMargins(cmdArgs.margin);
        for (Path file : sourceFiles) {
            layout.addSVG(SVGSource.load(file), 0, cmdArgs.alignment);
        }
        return layout;
    }

    static void run(CommandArgs cmdArgs, OutputStream stdout)
            throws IOException, JsonParseException, CompositionException {
        BoxLayout layout = createLayout(cmdArgs);
        Document svg = new SVGStack(layout).compose(cmdArgs.debugBoxes);

        if (cmdArgs.exportImages != null) {
            Path dir = (cmdArgs.outFile == null)
                       ? Path.of("")
                       : cmdArgs.outFile.toAbsolutePath().getParent();
            int count = ImageExport.exportImages(svg.getDocumentElement(),
                                                 dir, cmdArgs.exportImages, 1);
            log.info(() -> "Exported " + count + " image(s)");
        }

        if (cmdArgs.outFile == null) {
            SVGOutput.write(svg, stdout);
        } else {
            try (OutputStream out = Files.newOutputStream(cmdArgs.outFile)) {
                SVGOutput.write(svg, out);
            }
        }
    }

    public static void main(String[] args) {
        CommandArgs cmdArgs;
        try {
            cmdArgs = new CommandArgs(args);
        } catch (ArgumentException e) {
            System.err.println(errorMessage(e));
            System.err.println();
            printHelp(System.err);
            System.exit(e.status);
            return;
        }

        if (cmdArgs.help) {
            printHelp(System.out);
            return;
        }

        try {
            run(cmdArgs, System.out);
        } catch (IOException | JsonParseException | CompositionException e) {
            System.err.println(errorMessage(e));
            System.exit(STATUS_ERROR);
        }
    }

    /**
     * {@code Error: <Type>: <message>}, followed by a {@code Caused by:}
     * line for each distinct cause.  Argument errors get no type.
     */
    static String errorMessage(Throwable e) {
        if (e instanceof ArgumentException) {
            return "Error: " + e.getMessage();
        }

        StringBuilder buf = new StringBuilder("Error: ");
        String lastMessage = null;
        for (Throwable current = e; current != null; current = current.getCause()) {
            String message = current.getMessage();
            if (current != e) {
                // Wrappers often repeat the cause message
                if (message != null && message.equals(lastMessage))
                    continue;
                buf.append(System.lineSeparator()).append("Caused by: ");
            }
            buf.append(current.getClass().getSimpleName().replaceFirst("Exception$", ""));
            if (message != null) {
                buf.append(": ").append(message);
            }
            lastMessage = message;
        }
        return buf.toString();
    }

}
