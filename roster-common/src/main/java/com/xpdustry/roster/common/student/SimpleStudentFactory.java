package com.xpdustry.roster.common.student;

import com.xpdustry.roster.common.config.RosterConfig;
import jakarta.inject.Inject;

public final class SimpleStudentFactory implements StudentFactory {

    private final RosterConfig config;

    @Inject
    public SimpleStudentFactory(final RosterConfig config) {
        this.config = config;
    }

    @Override
    public Student create(final Classification classification, final Branch branch) {
        return Student.create(classification, branch, this.config.limits());
    }

    @Override
    public StudentLimits limits() {
        return this.config.limits();
    }
}
