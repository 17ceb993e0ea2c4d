/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.cli;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Poor man's command-line parser.  Registers handlers for flags and options
 * with a value, collects the remaining positional arguments.
 * <p>
 * Option values may be given as a separate argument ({@code -t 4}), attached
 * ({@code -t4}), or following a value separator ({@code --threads=4}).
 * Options may repeat, every occurrence is passed to the handler.</p>
 * <p>
 * Batteries <strong>not</strong> included:</p>
 * <ul>
 * <li>Automatic help text from option descriptions</li>
 * <li>Clustering/grouping of POSIX flags</li>
 * </ul>
 *
 * @see  <a href="https://picocli.info/">picocli</a> <i>(~406 KB)</i>
 */
public class CommandLine {

    private final NavigableMap<String, OptionHandler> registry = new TreeMap<>();

    private final Set<OptionHandler> seen = new LinkedHashSet<>();

    private final List<String> arguments = new ArrayList<>();

    private final String optionDelimiter;

    private final String valueSeparators;

    public CommandLine(String valueSeparators, String optionDelimiter) {
        this.valueSeparators = valueSeparators;
        this.optionDelimiter = optionDelimiter;
    }

    public static CommandLine ofUnixStyle() {
        return new CommandLine("=", "--");
    }

    /**
     * {@return the positional arguments remaining after parsing the known options}
     */
    public List<String> arguments() {
        return Collections.unmodifiableList(arguments);
    }

    public CommandLine acceptFlag(String option, Runnable action) {
        registry.put(option, new OptionHandler(option, false, value -> action.run()));
        return this;
    }

    public CommandLine acceptOption(String option, Consumer<? super String> action) {
        return acceptOption(option, action, Function.identity());
    }

    public <T>
    CommandLine acceptOption(String option,
                             Consumer<? super T> action,
                             Function<String, ? extends T> valueMapper) {
        registry.put(option, new OptionHandler(option, true, value -> {
            T mapped;
            try {
                mapped = valueMapper.apply(value);
            } catch (ArgumentException e) {
                throw ArgumentException.of(option, e.getMessage());
            } catch (RuntimeException e) {
                throw ArgumentException.of(option, e);
            }
            action.accept(mapped);
        }));
        return this;
    }

    public CommandLine acceptSynonyms(String option, String... synonyms) {
        OptionHandler handler = registry.get(option);
        if (handler == null)
            throw new IllegalArgumentException("Unknown option: " + option);

        for (String name : synonyms) {
            registry.put(name, handler);
        }
        return this;
    }

    public CommandLine parseOptions(String... args) {
        arguments.clear();
        seen.clear();

        boolean optionsEnd = false;
        for (int index = 0; index < args.length; index++) {
            String param = args[index];
            if (optionsEnd) {
                arguments.add(param);
                continue;
            }
            if (param.equals(optionDelimiter)) {
                optionsEnd = true;
                continue;
            }

            Map.Entry<String, OptionHandler> match = matchOption(param);
            if (match == null) {
                arguments.add(param);
                continue;
            }

            OptionHandler handler = match.getValue();
            String value = attachedValue(match.getKey(), param);
            if (handler.hasValue) {
                if (value == null) {
                    if (index + 1 >= args.length || matchOption(args[index + 1]) != null)
                        throw new ArgumentException(match.getKey() + " requires an argument");

                    value = args[++index];
                }
            } else if (value != null) {
                throw new ArgumentException(match.getKey() + " doesn't accept argument");
            }
            seen.add(handler);
            handler.action.accept(value);
        }
        return this;
    }

    private String attachedValue(String option, String param) {
        if (param.length() == option.length())
            return null;

        int offset = option.length();
        if (valueSeparators.indexOf(param.charAt(offset)) >= 0) {
            offset++;
        }
        return param.substring(offset);
    }

    /*private*/ Map.Entry<String, OptionHandler> matchOption(String arg) {
        if (arg.length() < 2 || arg.charAt(0) != '-')
            return null;

        // Longest registered option the argument starts with.
        Map.Entry<String, OptionHandler> entry = registry.floorEntry(arg);
        while (entry != null) {
            String name = entry.getKey();
            if (arg.startsWith(name)) {
                return entry;
            }
            if (name.isEmpty() || name.charAt(0) != arg.charAt(0))
                break;

            entry = registry.lowerEntry(name);
        }
        return null;
    }

    /**
     * Verifies each of the given options has been specified at least once.
     *
     * @throws  ArgumentException  naming the first missing option
     */
    public CommandLine requireOptions(String... options) {
        for (String name : options) {
            OptionHandler handler = registry.get(name);
            if (handler == null)
                throw new IllegalArgumentException("Unknown option: " + name);

            if (!seen.contains(handler))
                throw new ArgumentException("Specify " + name);
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

    public Optional<String> arg(int index) {
        return arguments.size() > index
                ? Optional.of(arguments.get(index))
                : Optional.empty();
    }

    /**
     * {@return a value mapper splitting comma-separated lists, mapping each
     * non-empty item through the given {@code itemMapper}}
     */
    public static <T>
    Function<String, List<T>> splitOnComma(Function<String, ? extends T> itemMapper) {
        return value -> {
            List<T> items = new ArrayList<>();
            for (String item : value.split(",")) {
                String trimmed = item.trim();
                if (!trimmed.isEmpty()) {
                    items.add(itemMapper.apply(trimmed));
                }
            }
            if (items.isEmpty())
                throw new ArgumentException("Empty list: " + Arrays.toString(value.split(",")));

            return items;
        };
    }


    private static final class OptionHandler {

        final String name;
        final boolean hasValue;
        final Consumer<String> action;

        OptionHandler(String name, boolean hasValue, Consumer<String> action) {
            this.name = name;
            this.hasValue = hasValue;
            this.action = action;
        }

        @Override
        public String toString() {
            return name;
        }

    } // class OptionHandler


    public static class ArgumentException extends RuntimeException {

        private static final long serialVersionUID = 2377641128045071432L;

        public ArgumentException(String message) {
            super(message);
        }

        public ArgumentException(String message, Throwable cause) {
            super(message, cause);
        }

        public static ArgumentException of(String argument, String message) {
            return new ArgumentException(argument + ": " + message);
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
