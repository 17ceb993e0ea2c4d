/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgrender.config;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Signals a malformed render configuration file, as opposed to an error
 * reading it.
 */
public class ConfigParseException extends IOException {

    private static final long serialVersionUID = 5170489256108931741L;

    public ConfigParseException(Path file, String message) {
        super(file + ": " + message);
    }

    public ConfigParseException(Path file, String message, Throwable cause) {
        super(file + ": " + message, cause);
    }

}
