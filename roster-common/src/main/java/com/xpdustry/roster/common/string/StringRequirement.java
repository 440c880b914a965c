package com.xpdustry.roster.common.string;

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.xpdustry.roster.common.error.RosterError;
import java.util.List;

public sealed interface StringRequirement {

    List<StringRequirement> IDENTITY_REQUIREMENTS = List.of(
            new NotEmpty(RosterError.EMPTY_IDENTITY),
            new AllowedCharacters(Letter.ALPHANUMERIC, "/-", RosterError.INVALID_IDENTITY_CHAR));

    List<StringRequirement> NAME_REQUIREMENTS = List.of(
            new NotEmpty(RosterError.EMPTY_NAME),
            new AllowedCharacters(Letter.ALPHABETIC, " -", RosterError.INVALID_NAME_CHAR),
            new MinimumTokens(2, RosterError.MISSING_SECOND_TOKEN),
            new TokenCharacters(1, Letter.ALPHABETIC, "-", RosterError.INVALID_SECOND_TOKEN));

    boolean isSatisfiedBy(final CharSequence string);

    RosterError error();

    enum Letter {
        ALPHABETIC(CharMatcher.inRange('a', 'z').or(CharMatcher.inRange('A', 'Z'))),
        ALPHANUMERIC(CharMatcher.inRange('a', 'z')
                .or(CharMatcher.inRange('A', 'Z'))
                .or(CharMatcher.inRange('0', '9')));

        private final CharMatcher matcher;

        Letter(final CharMatcher matcher) {
            this.matcher = matcher.precomputed();
        }

        public CharMatcher matcher() {
            return this.matcher;
        }
    }

    record NotEmpty(RosterError error) implements StringRequirement {

        @Override
        public boolean isSatisfiedBy(final CharSequence string) {
            return string.length() > 0;
        }
    }

    record AllowedCharacters(Letter letter, String allowed, RosterError error) implements StringRequirement {

        @Override
        public boolean isSatisfiedBy(final CharSequence string) {
            return this.letter.matcher().or(CharMatcher.anyOf(this.allowed)).matchesAllOf(string);
        }
    }

    record MinimumTokens(int count, RosterError error) implements StringRequirement {

        public MinimumTokens {
            Preconditions.checkArgument(count > 0, "count must be positive, got %s", count);
        }

        @Override
        public boolean isSatisfiedBy(final CharSequence string) {
            return NameTokens.split(string).size() >= this.count;
        }
    }

    // Only looks at one token, a missing token is MinimumTokens business
    record TokenCharacters(int index, Letter letter, String allowed, RosterError error) implements StringRequirement {

        public TokenCharacters {
            Preconditions.checkArgument(index >= 0, "index must not be negative, got %s", index);
        }

        @Override
        public boolean isSatisfiedBy(final CharSequence string) {
            final var tokens = NameTokens.split(string);
            return tokens.size() <= this.index
                    || this.letter.matcher().or(CharMatcher.anyOf(this.allowed)).matchesAllOf(tokens.get(this.index));
        }
    }

    record Capacity(int capacity) implements StringRequirement {

        public Capacity {
            Preconditions.checkArgument(capacity > 0, "capacity must be positive, got %s", capacity);
        }

        @Override
        public boolean isSatisfiedBy(final CharSequence string) {
            // One slot is reserved for the terminator
            return string.length() < this.capacity;
        }

        @Override
        public RosterError error() {
            return RosterError.OVERFLOW;
        }
    }
}
