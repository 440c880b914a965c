package com.xpdustry.roster.common.sort;

import com.google.common.base.Preconditions;
import com.xpdustry.roster.common.student.MarkComponent;
import com.xpdustry.roster.common.student.Student;
import java.util.Comparator;

public final class StudentComparators {

    // Identities are ASCII, so String order is byte order
    public static final Comparator<Student> BY_IDENTITY = Comparator.comparing(Student::identity);

    private StudentComparators() {}

    public static Comparator<Student> byComponent(final MarkComponent component) {
        Preconditions.checkNotNull(component, "component");
        // + 0.0 folds -0.0 into 0.0 so both tie on identity
        return Comparator.<Student>comparingDouble(student -> student.mark(component) + 0.0)
                .thenComparing(BY_IDENTITY);
    }
}
