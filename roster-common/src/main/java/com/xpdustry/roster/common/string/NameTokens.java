package com.xpdustry.roster.common.string;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import java.util.List;

final class NameTokens {

    private static final Splitter SPLITTER =
            Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

    private NameTokens() {}

    static List<String> split(final CharSequence string) {
        return SPLITTER.splitToList(string);
    }
}
