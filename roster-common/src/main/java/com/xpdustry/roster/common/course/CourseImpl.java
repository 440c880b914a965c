package com.xpdustry.roster.common.course;

import com.google.common.base.Preconditions;
import com.google.common.collect.Iterators;
import com.google.common.collect.Sets;
import com.xpdustry.roster.common.error.RosterError;
import com.xpdustry.roster.common.functional.RosterResult;
import com.xpdustry.roster.common.student.Student;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class CourseImpl implements Course {

    private static final Logger LOGGER = LoggerFactory.getLogger(CourseImpl.class);

    private final List<Student> students = new ArrayList<>();
    private final Set<Student> owned = Sets.newIdentityHashSet();

    @Override
    public RosterResult<Student, RosterError> add(final Student student) {
        Preconditions.checkNotNull(student, "student");
        Preconditions.checkArgument(
                !this.owned.contains(student),
                "Student %s is already in this course",
                student.identity());

        if (student.identity().isEmpty()) {
            return RosterResult.failure(RosterError.EMPTY_IDENTITY);
        }
        if (student.name().isEmpty()) {
            return RosterResult.failure(RosterError.EMPTY_NAME);
        }

        this.students.add(student);
        this.owned.add(student);
        LOGGER.debug("Added student {} to course, {} enrolled", student.identity(), this.students.size());
        return RosterResult.success(student);
    }

    @Override
    public Optional<Student> findByIdentity(final String identity) {
        Preconditions.checkNotNull(identity, "identity");
        for (final var student : this.students) {
            if (student.identity().equals(identity)) {
                return Optional.of(student);
            }
        }
        return Optional.empty();
    }

    @Override
    public RosterResult<Student, RosterError> lookup(final String identity) {
        return this.findByIdentity(identity)
                .<RosterResult<Student, RosterError>>map(RosterResult::success)
                .orElseGet(() -> RosterResult.failure(RosterError.IDENTITY_NOT_FOUND));
    }

    @Override
    public boolean remove(final String identity) {
        Preconditions.checkNotNull(identity, "identity");
        final var iterator = this.students.iterator();
        while (iterator.hasNext()) {
            final var student = iterator.next();
            if (student.identity().equals(identity)) {
                iterator.remove();
                this.owned.remove(student);
                LOGGER.debug("Removed student {} from course, {} enrolled", identity, this.students.size());
                return true;
            }
        }
        return false;
    }

    @Override
    public Student[] exportSnapshot() {
        return this.students.toArray(new Student[0]);
    }

    @Override
    public int size() {
        return this.students.size();
    }

    @Override
    public Iterator<Student> iterator() {
        return Iterators.unmodifiableIterator(this.students.iterator());
    }
}
