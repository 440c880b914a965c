package com.xpdustry.roster.common.config;

import com.xpdustry.roster.common.student.StudentLimits;
import org.jspecify.annotations.Nullable;

public record RosterConfig(StudentLimits limits) {

    public static final RosterConfig DEFAULT = new RosterConfig(StudentLimits.DEFAULT);

    public RosterConfig(final @Nullable StudentLimits limits) {
        this.limits = limits == null ? StudentLimits.DEFAULT : limits;
    }
}
