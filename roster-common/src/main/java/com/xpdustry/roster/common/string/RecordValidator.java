package com.xpdustry.roster.common.string;

import com.google.common.base.Preconditions;
import com.xpdustry.roster.common.error.RosterError;
import com.xpdustry.roster.common.functional.RosterResult;
import java.util.List;

public final class RecordValidator {

    private RecordValidator() {}

    public static RosterResult<String, RosterError> validateIdentity(final String identity) {
        return check(identity, StringRequirement.IDENTITY_REQUIREMENTS);
    }

    public static RosterResult<String, RosterError> validateName(final String name) {
        return check(name, StringRequirement.NAME_REQUIREMENTS);
    }

    public static RosterResult<String, RosterError> copyBounded(final int capacity, final String source) {
        return check(source, List.of(new StringRequirement.Capacity(capacity)));
    }

    public static RosterResult<String, RosterError> check(
            final String string, final List<StringRequirement> requirements) {
        Preconditions.checkNotNull(string, "string");
        for (final var requirement : requirements) {
            if (!requirement.isSatisfiedBy(string)) {
                return RosterResult.failure(requirement.error());
            }
        }
        return RosterResult.success(string);
    }
}
