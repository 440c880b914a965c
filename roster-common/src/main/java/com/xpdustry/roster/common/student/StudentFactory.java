package com.xpdustry.roster.common.student;

public interface StudentFactory {

    Student create(final Classification classification, final Branch branch);

    StudentLimits limits();
}
