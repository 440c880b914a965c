package com.xpdustry.roster.common.student;

import com.google.common.base.Preconditions;

public record StudentLimits(int name, int identity) {

    public static final StudentLimits DEFAULT = new StudentLimits(64, 32);

    public StudentLimits {
        Preconditions.checkArgument(name > 1, "name limit must be greater than 1, got %s", name);
        Preconditions.checkArgument(identity > 1, "identity limit must be greater than 1, got %s", identity);
    }
}
