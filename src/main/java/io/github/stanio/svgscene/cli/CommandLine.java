/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgscene.cli;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Unix-style command-line option parser.
 * <p>
 * Options take their value either attached ({@code --config=file.json})
 * or as the next argument ({@code --config file.json}).  Arguments after
 * a {@code --} delimiter are never treated as options.  Anything that is
 * not a registered option remains as a positional argument.</p>
 */
public class CommandLine {

    private static final String OPTION_DELIMITER = "--";

    private final Map<String, OptionHandler> options = new HashMap<>();

    private final List<String> arguments = new ArrayList<>();

    public static CommandLine ofUnixStyle() {
        return new CommandLine();
    }

    /**
     * {@return the positional arguments remaining after parsing the
     * known options}
     */
    public List<String> arguments() {
        return Collections.unmodifiableList(arguments);
    }

    public CommandLine acceptFlag(String option, Runnable action) {
        options.put(option, new OptionHandler(false, value -> {
            if (value != null)
                throw new ArgumentException(option + " doesn't accept argument");

            action.run();
        }));
        return this;
    }

    public CommandLine acceptOption(String option, Consumer<? super String> action) {
        return acceptOption(option, action, Function.identity());
    }

    public <T> CommandLine acceptOption(String option,
                                        Consumer<? super T> action,
                                        Function<String, ? extends T> valueMapper) {
        options.put(option, new OptionHandler(true, value -> {
            T mapped;
            try {
                mapped = valueMapper.apply(value);
            } catch (RuntimeException e) {
                throw ArgumentException.of(option, e);
            }
            action.accept(mapped);
        }));
        return this;
    }

    public CommandLine acceptSynonyms(String option, String... synonyms) {
        OptionHandler handler = options.get(option);
        if (handler == null) {
            throw new IllegalStateException("Unknown option: " + option);
        }
        for (String name : synonyms) {
            options.put(name, handler);
        }
        return this;
    }

    public CommandLine parseOptions(String... args) {
        arguments.clear();
        boolean optionsEnded = false;
        List<String> params = new ArrayList<>(List.of(args));
        Iterator<String> iter = params.iterator();
        while (iter.hasNext()) {
            String param = iter.next();
            if (optionsEnded) {
                arguments.add(param);
                continue;
            }
            if (param.equals(OPTION_DELIMITER)) {
                optionsEnded = true;
                continue;
            }

            int separator = param.indexOf('=');
            String name = (separator < 0) ? param : param.substring(0, separator);
            OptionHandler handler = options.get(name);
            if (handler == null) {
                arguments.add(param);
                continue;
            }

            String value = (separator < 0) ? null : param.substring(separator + 1);
            if (value == null && handler.requiresArg) {
                if (!iter.hasNext()) {
                    throw new ArgumentException(name + " requires an argument");
                }
                value = iter.next();
            }
            handler.action.accept(value);
        }
        return this;
    }

    public CommandLine withMaxArgs(int count) {
        int extraSize = arguments.size() - count;
        if (extraSize > 0) {
            throw new ArgumentException(extraSize + " too many argument(s): "
                    + String.join(" ", arguments.subList(count, arguments.size())));
        }
        return this;
    }

    public String requireArg(int index, String name) {
        return requireArg(index, name, Function.identity());
    }

    public <T> T requireArg(int index, String name,
                            Function<String, ? extends T> valueMapper) {
        return arg(index, name, valueMapper)
                .orElseThrow(() -> new ArgumentException("Specify " + name));
    }

    public <T> Optional<T> arg(int index, String name,
                               Function<String, ? extends T> valueMapper) {
        if (index >= arguments.size())
            return Optional.empty();

        try {
            return Optional.of(valueMapper.apply(arguments.get(index)));
        } catch (RuntimeException e) {
            throw ArgumentException.of(name, e);
        }
    }


    private static class OptionHandler {

        final boolean requiresArg;
        final Consumer<String> action;

        OptionHandler(boolean requiresArg, Consumer<String> action) {
            this.requiresArg = requiresArg;
            this.action = action;
        }

    } // class OptionHandler


    public static class ArgumentException extends RuntimeException {

        private static final long serialVersionUID = 5172738021566093517L;

        public ArgumentException(String message) {
            super(message);
        }

        public ArgumentException(String message, Throwable cause) {
            super(message, cause);
        }

        public static ArgumentException of(String argument, Throwable cause) {
            return new ArgumentException(argument
                    + ": " + userMessage(cause), cause);
        }

        public static String userMessage(Throwable cause) {
            String message = cause.getMessage();
            String type = cause.getClass().getSimpleName()
                               .replaceFirst("(Runtime)?Exception$", "");
            return type.isEmpty() ? message : type + ": " + message;
        }

    } // class ArgumentException


} // class CommandLine
