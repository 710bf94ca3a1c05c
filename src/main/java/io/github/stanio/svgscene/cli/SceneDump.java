/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgscene.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.function.Consumer;
import java.util.logging.Level;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonIOException;
import com.google.gson.JsonParseException;

import io.github.stanio.svgscene.cli.CommandLine.ArgumentException;
import io.github.stanio.svgscene.scene.Group;
import io.github.stanio.svgscene.svg.SVGParser;
import io.github.stanio.svgscene.svg.SceneDefaults;

/**
 * Prints the scene compiled from an SVG document as JSON.
 * <pre>
 * USAGE: svgscene [--config=&lt;defaults.json&gt;] [--compact] &lt;file.svg&gt;</pre>
 */
public class SceneDump {

    private final SVGParser parser;
    private final Gson gson;

    public SceneDump(SceneDefaults defaults, boolean compact) {
        this.parser = SVGParser.builder()
                .defaults(defaults)
                .diagnostics(problem -> {
                    if (problem.level() == Level.WARNING) {
                        System.err.println("Warning: " + problem);
                    }
                })
                .build();
        GsonBuilder builder = new GsonBuilder();
        if (!compact) {
            builder.setPrettyPrinting();
        }
        this.gson = builder.create();
    }

    public void dump(Path file, Appendable out) throws IOException {
        Group scene = parser.parse(file);
        try {
            gson.toJson(SceneJson.toJson(scene), out);
        } catch (JsonIOException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            throw e;
        }
    }

    public static void main(String[] args) {
        CommandArgs cmdArgs;
        try {
            cmdArgs = new CommandArgs(args);
        } catch (ArgumentException e) {
            exitMessage(1, CommandArgs::printHelp, "Error: ", e.getMessage());
            return;
        }

        SceneDefaults defaults = SceneDefaults.standard();
        if (cmdArgs.configFile != null) {
            try {
                defaults = SceneDefaults.load(cmdArgs.configFile);
            } catch (IOException | JsonParseException e) {
                exitMessage(2, null, "Could not read configuration: ", e);
                return;
            }
        }

        try {
            new SceneDump(defaults, cmdArgs.compact)
                    .dump(cmdArgs.svgFile, System.out);
            System.out.println();
        } catch (IOException e) {
            exitMessage(2, null, "Error: ", e);
        } catch (RuntimeException e) {
            e.printStackTrace(System.err);
            exitMessage(3, null, "Internal Error: ", e);
        }
    }

    static void exitMessage(int status,
            Consumer<PrintStream> help, Object... message) {
        PrintStream out = (status == 0) ? System.out : System.err;
        for (Object item : message) {
            if (item instanceof Throwable) {
                printMessage(out, (Throwable) item);
            } else {
                out.print(item);
            }
        }
        if (message.length > 0) {
            out.println();
        }

        if (help != null) {
            if (message.length > 0) {
                out.println();
            }
            help.accept(out);
        }

        System.exit(status);
    }

    private static void printMessage(PrintStream out, Throwable e) {
        for (Throwable current = e; current != null; current = current.getCause()) {
            if (current != e) {
                out.println();
                out.print("Caused by: ");
            }
            String type = current.getClass().getSimpleName()
                                 .replaceFirst("Exception$", "");
            String message = current.getMessage();
            out.print(message == null ? type : type + ": " + message);
        }
    }


    static class CommandArgs {

        Path configFile;
        boolean compact;
        Path svgFile;

        CommandArgs(String... args) {
            CommandLine cmd = CommandLine.ofUnixStyle()
                    .acceptOption("--config", val -> configFile = val, Path::of)
                    .acceptFlag("--compact", () -> compact = true)
                    .acceptFlag("-h", () -> exitMessage(0, CommandArgs::printHelp))
                    .acceptSynonyms("-h", "--help")
                    .parseOptions(args)
                    .withMaxArgs(1);

            svgFile = cmd.requireArg(0, "<file.svg>", Path::of);
        }

        static void printHelp(PrintStream out) {
            out.println("USAGE: svgscene [--config=<defaults.json>] [--compact] <file.svg>");
            out.println();
            out.println("Prints the scene graph compiled from <file.svg> as JSON.");
        }

    } // class CommandArgs


}
