package com.xpdustry.roster.common.student;

import java.util.Objects;

public final class Marks {

    private double assignment;
    private double midterm;
    private double lab;
    private double finalExam;

    public Marks() {}

    public Marks(final double assignment, final double midterm, final double lab, final double finalExam) {
        this.assignment = assignment;
        this.midterm = midterm;
        this.lab = lab;
        this.finalExam = finalExam;
    }

    public double get(final MarkComponent component) {
        return switch (component) {
            case ASSIGNMENT -> this.assignment;
            case MIDTERM -> this.midterm;
            case LAB -> this.lab;
            case FINAL -> this.finalExam;
        };
    }

    public void set(final MarkComponent component, final double value) {
        switch (component) {
            case ASSIGNMENT -> this.assignment = value;
            case MIDTERM -> this.midterm = value;
            case LAB -> this.lab = value;
            case FINAL -> this.finalExam = value;
        }
    }

    public double assignment() {
        return this.assignment;
    }

    public void setAssignment(final double assignment) {
        this.assignment = assignment;
    }

    public double midterm() {
        return this.midterm;
    }

    public void setMidterm(final double midterm) {
        this.midterm = midterm;
    }

    public double lab() {
        return this.lab;
    }

    public void setLab(final double lab) {
        this.lab = lab;
    }

    public double finalExam() {
        return this.finalExam;
    }

    public void setFinalExam(final double finalExam) {
        this.finalExam = finalExam;
    }

    public double total() {
        return this.assignment + this.midterm + this.lab + this.finalExam;
    }

    public Marks copy() {
        return new Marks(this.assignment, this.midterm, this.lab, this.finalExam);
    }

    @Override
    public boolean equals(final Object obj) {
        return obj instanceof Marks that
                && Double.compare(this.assignment, that.assignment) == 0
                && Double.compare(this.midterm, that.midterm) == 0
                && Double.compare(this.lab, that.lab) == 0
                && Double.compare(this.finalExam, that.finalExam) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.assignment, this.midterm, this.lab, this.finalExam);
    }

    @Override
    public String toString() {
        return "Marks{assignment=" + this.assignment + ", midterm=" + this.midterm + ", lab=" + this.lab
                + ", finalExam=" + this.finalExam + '}';
    }
}
