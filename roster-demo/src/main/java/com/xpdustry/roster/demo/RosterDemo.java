package com.xpdustry.roster.demo;

import com.xpdustry.roster.common.course.Course;
import com.xpdustry.roster.common.error.RosterError;
import com.xpdustry.roster.common.error.RosterException;
import com.xpdustry.roster.common.functional.RosterResult;
import com.xpdustry.roster.common.render.StudentRenderer;
import com.xpdustry.roster.common.sort.StudentSorter;
import com.xpdustry.roster.common.student.Branch;
import com.xpdustry.roster.common.student.Classification;
import com.xpdustry.roster.common.student.MarkComponent;
import com.xpdustry.roster.common.student.Marks;
import com.xpdustry.roster.common.student.Student;
import com.xpdustry.roster.common.student.StudentFactory;
import jakarta.inject.Inject;
import java.io.PrintStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class RosterDemo {

    private static final Logger LOGGER = LoggerFactory.getLogger(RosterDemo.class);

    private final StudentFactory students;
    private final StudentSorter sorter;
    private final StudentRenderer renderer;

    @Inject
    public RosterDemo(final StudentFactory students, final StudentSorter sorter, final StudentRenderer renderer) {
        this.students = students;
        this.sorter = sorter;
        this.renderer = renderer;
    }

    public Course run(final PrintStream out) {
        final var course = Course.create();

        this.report(
                out,
                "adding student",
                this.enroll(
                        course, Classification.BTECH, Branch.CSE, "Amit Kumar", "20CS1001", new Marks(15, 24, 10, 45)));
        this.report(
                out,
                "adding student",
                this.enroll(
                        course,
                        Classification.MTECH,
                        Branch.ECE,
                        "Sunita Sharma",
                        "21EC2001",
                        new Marks(18, 28, 12, 40)));
        this.report(
                out,
                "adding student",
                this.enroll(
                        course, Classification.PHD, Branch.CSE, "Rahul Verma", "19CS0999", new Marks(20, 30, 15, 50)));

        out.println("All students (insertion order):");
        this.print(out, course.exportSnapshot());

        out.println();
        out.println("Modifying marks for roll 21EC2001");
        final var modified = course.lookup("21EC2001").orElseThrow(RosterException::new);
        final var marks = modified.marks();
        marks.setFinalExam(42.5);
        modified.setMarks(marks);
        out.println("After modification:");
        out.println(this.renderer.render(modified));

        out.println();
        out.println("Totals:");
        final var snapshot = course.exportSnapshot();
        for (final var student : snapshot) {
            out.println(student.identity() + " -> Total = " + this.renderer.renderNumber(student.total()));
        }

        out.println();
        out.println("Sorted by roll:");
        this.sorter.sortByIdentity(snapshot);
        this.print(out, snapshot);

        out.println();
        out.println("Sorted by midterm marks:");
        final var byMidterm = course.exportSnapshot();
        this.sorter.sortByComponent(byMidterm, MarkComponent.MIDTERM);
        this.print(out, byMidterm);

        out.println();
        out.println("Sorted by name (Trie):");
        this.print(out, this.sorter.sortByName(course));

        out.println();
        this.report(
                out,
                "adding student",
                this.enroll(course, Classification.BTECH, Branch.CSE, "SingleName", "20CS1002", new Marks()));
        this.report(
                out,
                "adding student",
                this.enroll(course, Classification.BTECH, Branch.CSE, "Maya Rao", "20CS#1003", new Marks()));
        this.report(out, "accessing student", course.lookup("0000/NOTFOUND"));

        return course;
    }

    private RosterResult<Student, RosterError> enroll(
            final Course course,
            final Classification classification,
            final Branch branch,
            final String name,
            final String identity,
            final Marks marks) {
        final var student = this.students.create(classification, branch);
        student.setMarks(marks);
        return student.setName(name)
                .flatMap(ignored -> student.setIdentity(identity))
                .flatMap(ignored -> course.add(student));
    }

    private void report(final PrintStream out, final String action, final RosterResult<Student, RosterError> result) {
        if (result.isFailure()) {
            LOGGER.warn("Rejected while {}: {}", action, result.error());
            out.println("Caught error while " + action + ": " + result.error().message());
        }
    }

    private void print(final PrintStream out, final Student[] students) {
        for (final var student : students) {
            out.println(this.renderer.render(student));
        }
    }
}
