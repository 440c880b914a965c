package com.xpdustry.roster.common.sort;

import com.xpdustry.roster.common.course.Course;
import com.xpdustry.roster.common.student.MarkComponent;
import com.xpdustry.roster.common.student.Student;

public interface StudentSorter {

    void sortByIdentity(final Student[] snapshot);

    void sortByComponent(final Student[] snapshot, final MarkComponent component);

    Student[] sortByName(final Course course);
}
