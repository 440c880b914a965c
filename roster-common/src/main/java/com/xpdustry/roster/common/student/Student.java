package com.xpdustry.roster.common.student;

import com.google.common.base.Preconditions;
import com.xpdustry.roster.common.error.RosterError;
import com.xpdustry.roster.common.functional.RosterResult;
import com.xpdustry.roster.common.string.RecordValidator;

public final class Student {

    private final Classification classification;
    private final StudentLimits limits;
    private String identity = "";
    private String name = "";
    private Branch branch;
    private Marks marks = new Marks();

    private Student(final Classification classification, final Branch branch, final StudentLimits limits) {
        this.classification = Preconditions.checkNotNull(classification, "classification");
        this.branch = Preconditions.checkNotNull(branch, "branch");
        this.limits = Preconditions.checkNotNull(limits, "limits");
    }

    public static Student create(final Classification classification, final Branch branch) {
        return new Student(classification, branch, StudentLimits.DEFAULT);
    }

    public static Student create(
            final Classification classification, final Branch branch, final StudentLimits limits) {
        return new Student(classification, branch, limits);
    }

    public String identity() {
        return this.identity;
    }

    // Left untouched when the result is a failure
    public RosterResult<String, RosterError> setIdentity(final String identity) {
        final var result = RecordValidator.validateIdentity(identity)
                .flatMap(valid -> RecordValidator.copyBounded(this.limits.identity(), valid));
        if (result.isSuccess()) {
            this.identity = result.value();
        }
        return result;
    }

    public String name() {
        return this.name;
    }

    public RosterResult<String, RosterError> setName(final String name) {
        final var result = RecordValidator.validateName(name)
                .flatMap(valid -> RecordValidator.copyBounded(this.limits.name(), valid));
        if (result.isSuccess()) {
            this.name = result.value();
        }
        return result;
    }

    public Classification classification() {
        return this.classification;
    }

    public Branch branch() {
        return this.branch;
    }

    public void setBranch(final Branch branch) {
        this.branch = Preconditions.checkNotNull(branch, "branch");
    }

    public Marks marks() {
        return this.marks.copy();
    }

    public void setMarks(final Marks marks) {
        this.marks = Preconditions.checkNotNull(marks, "marks").copy();
    }

    public double mark(final MarkComponent component) {
        return this.marks.get(component);
    }

    public double total() {
        return this.marks.total();
    }

    public StudentLimits limits() {
        return this.limits;
    }

    @Override
    public String toString() {
        return "Student{identity=" + this.identity + ", name=" + this.name + ", classification="
                + this.classification + ", branch=" + this.branch + ", marks=" + this.marks + '}';
    }
}
