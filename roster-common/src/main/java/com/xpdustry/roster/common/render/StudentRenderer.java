package com.xpdustry.roster.common.render;

import com.xpdustry.roster.common.student.Student;

public interface StudentRenderer {

    String render(final Student student);

    String renderNumber(final double number);
}
