package com.xpdustry.roster.common;

import com.xpdustry.roster.common.config.RosterConfig;
import com.xpdustry.roster.common.config.RosterConfigProvider;
import com.xpdustry.roster.common.factory.ObjectBinder;
import com.xpdustry.roster.common.factory.ObjectModule;
import com.xpdustry.roster.common.render.SimpleStudentRenderer;
import com.xpdustry.roster.common.render.StudentRenderer;
import com.xpdustry.roster.common.sort.SimpleStudentSorter;
import com.xpdustry.roster.common.sort.StudentSorter;
import com.xpdustry.roster.common.student.SimpleStudentFactory;
import com.xpdustry.roster.common.student.StudentFactory;

public final class RosterModule implements ObjectModule {

    @Override
    public void configure(final ObjectBinder binder) {
        binder.bind(RosterConfig.class).toProv(RosterConfigProvider.class);
        binder.bind(StudentFactory.class).toImpl(SimpleStudentFactory.class);
        binder.bind(StudentSorter.class).toImpl(SimpleStudentSorter.class);
        binder.bind(StudentRenderer.class).toImpl(SimpleStudentRenderer.class);
    }
}
