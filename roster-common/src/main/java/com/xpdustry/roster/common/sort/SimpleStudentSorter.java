package com.xpdustry.roster.common.sort;

import com.google.common.base.Preconditions;
import com.xpdustry.roster.common.collection.NameTrie;
import com.xpdustry.roster.common.course.Course;
import com.xpdustry.roster.common.student.MarkComponent;
import com.xpdustry.roster.common.student.Student;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class SimpleStudentSorter implements StudentSorter {

    private static final Logger LOGGER = LoggerFactory.getLogger(SimpleStudentSorter.class);

    @Override
    public void sortByIdentity(final Student[] snapshot) {
        QuickSort.sort(snapshot, StudentComparators.BY_IDENTITY);
        LOGGER.debug("Sorted {} students by identity", snapshot.length);
    }

    @Override
    public void sortByComponent(final Student[] snapshot, final MarkComponent component) {
        QuickSort.sort(snapshot, StudentComparators.byComponent(component));
        LOGGER.debug("Sorted {} students by {}", snapshot.length, component);
    }

    @Override
    public Student[] sortByName(final Course course) {
        Preconditions.checkNotNull(course, "course");
        final var snapshot = course.exportSnapshot();
        if (snapshot.length == 0) {
            return snapshot;
        }
        final NameTrie.Mutable<Student> trie = NameTrie.create();
        for (final var student : snapshot) {
            trie.insert(student.name(), student);
        }
        final var sorted = trie.collect().toArray(new Student[0]);
        Preconditions.checkState(
                sorted.length == snapshot.length, "Lost students while sorting by name: %s", sorted.length);
        LOGGER.debug("Sorted {} students by name", sorted.length);
        return sorted;
    }
}
