package com.xpdustry.roster.common.render;

import com.xpdustry.roster.common.student.MarkComponent;
import com.xpdustry.roster.common.student.Student;
import java.math.BigDecimal;
import java.math.MathContext;

public final class SimpleStudentRenderer implements StudentRenderer {

    // Six significant digits, like a default C stream
    private static final MathContext PRECISION = new MathContext(6);

    @Override
    public String render(final Student student) {
        final var builder = new StringBuilder()
                .append("Roll: ")
                .append(student.identity())
                .append(" | Name: ")
                .append(student.name())
                .append(" | Level: ")
                .append(student.classification().label())
                .append(" | Branch: ")
                .append(student.branch().label())
                .append(" | Marks:");
        for (final var component : MarkComponent.values()) {
            builder.append(' ')
                    .append(component.symbol())
                    .append('=')
                    .append(this.renderNumber(student.mark(component)));
        }
        return builder.append(" | Total=")
                .append(this.renderNumber(student.total()))
                .toString();
    }

    @Override
    public String renderNumber(final double number) {
        if (!Double.isFinite(number)) {
            return Double.toString(number);
        }
        return BigDecimal.valueOf(number)
                .round(PRECISION)
                .stripTrailingZeros()
                .toPlainString();
    }
}
