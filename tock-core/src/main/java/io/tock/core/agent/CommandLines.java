package io.tock.core.agent;

import java.util.List;
import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;

/**
 * Splits a command string into an argument vector on runs of whitespace.
 * Quotes and escapes have no special meaning.
 */
public final class CommandLines
{
    private static final Splitter SPLITTER = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

    private CommandLines()
    { }

    public static List<String> tokenize(String command)
    {
        return SPLITTER.splitToList(command);
    }
}
