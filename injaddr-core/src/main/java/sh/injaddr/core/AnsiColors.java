// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.injaddr.core;

/**
 * ANSI colors for debug log lines, disabled automatically outside a TTY
 * unless {@code FORCE_COLOR=true} is set.
 *
 * @see LogFormatter
 */
public final class AnsiColors {

    private static final boolean IS_TTY = System.console() != null
            || "true".equals(System.getenv("FORCE_COLOR"));

    /** ANSI reset code - clears all formatting */
    public static final String RESET = ansi("0");

    /** Teal - success */
    public static final String TEAL = ansi("38;5;44");

    /** Coral - failure */
    public static final String CORAL = ansi("38;5;204");

    /** Indigo - informational */
    public static final String INDIGO = ansi("38;5;99");

    /** Slate - metadata */
    public static final String SLATE = ansi("38;5;247");

    private AnsiColors() {
    }

    private static String ansi(final String code) {
        return IS_TTY ? "\u001B[" + code + "m" : "";
    }
}
