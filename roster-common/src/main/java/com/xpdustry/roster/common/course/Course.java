package com.xpdustry.roster.common.course;

import com.xpdustry.roster.common.error.RosterError;
import com.xpdustry.roster.common.functional.RosterResult;
import com.xpdustry.roster.common.student.Student;
import java.util.Optional;

public interface Course extends Iterable<Student> {

    static Course create() {
        return new CourseImpl();
    }

    RosterResult<Student, RosterError> add(final Student student);

    Optional<Student> findByIdentity(final String identity);

    RosterResult<Student, RosterError> lookup(final String identity);

    boolean remove(final String identity);

    Student[] exportSnapshot();

    int size();

    default boolean isEmpty() {
        return this.size() == 0;
    }
}
