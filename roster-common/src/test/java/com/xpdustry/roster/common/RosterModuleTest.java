package com.xpdustry.roster.common;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.xpdustry.roster.common.config.RosterConfig;
import com.xpdustry.roster.common.config.RosterConfigProvider;
import com.xpdustry.roster.common.error.RosterError;
import com.xpdustry.roster.common.factory.ObjectBinder;
import com.xpdustry.roster.common.factory.ObjectFactory;
import com.xpdustry.roster.common.factory.ObjectFactoryInitializationException;
import com.xpdustry.roster.common.factory.ObjectModule;
import com.xpdustry.roster.common.render.SimpleStudentRenderer;
import com.xpdustry.roster.common.render.StudentRenderer;
import com.xpdustry.roster.common.sort.SimpleStudentSorter;
import com.xpdustry.roster.common.sort.StudentSorter;
import com.xpdustry.roster.common.student.Branch;
import com.xpdustry.roster.common.student.Classification;
import com.xpdustry.roster.common.student.StudentFactory;
import com.xpdustry.roster.common.student.StudentLimits;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class RosterModuleTest {

    @Test
    void test_bindings(final @TempDir Path temp) throws ObjectFactoryInitializationException {
        final var factory = ObjectFactory.create(new RosterModule(), new TestModule(temp));
        factory.initialize();

        assertThat(factory.get(RosterConfig.class)).isEqualTo(RosterConfig.DEFAULT);
        assertThat(factory.get(StudentSorter.class)).isInstanceOf(SimpleStudentSorter.class);
        assertThat(factory.get(StudentRenderer.class)).isInstanceOf(SimpleStudentRenderer.class);
        assertThat(factory.get(StudentSorter.class)).isSameAs(factory.get(StudentSorter.class));
        assertThat(factory.get(Path.class, "directory")).isEqualTo(temp);
    }

    @Test
    void test_configured_limits(final @TempDir Path temp) throws IOException, ObjectFactoryInitializationException {
        Files.writeString(
                temp.resolve(RosterConfigProvider.FILE_NAME), "{\"limits\": {\"name\": 12, \"identity\": 6}}");
        final var factory = ObjectFactory.create(new RosterModule(), new TestModule(temp));
        factory.initialize();

        final var students = factory.get(StudentFactory.class);
        assertThat(students.limits()).isEqualTo(new StudentLimits(12, 6));
        final var student = students.create(Classification.PHD, Branch.ECE);
        assertThat(student.limits()).isEqualTo(new StudentLimits(12, 6));
        assertThat(student.setIdentity("123456").error()).isEqualTo(RosterError.OVERFLOW);
        assertThat(student.setIdentity("12345").isSuccess()).isTrue();
    }

    @Test
    void test_invalid_config_fails_initialization(final @TempDir Path temp) throws IOException {
        Files.writeString(temp.resolve(RosterConfigProvider.FILE_NAME), "not json at all {");
        final var factory = ObjectFactory.create(new RosterModule(), new TestModule(temp));
        assertThatThrownBy(factory::initialize).isInstanceOf(ObjectFactoryInitializationException.class);
    }

    @Test
    void test_lifecycle_misuse(final @TempDir Path temp) throws ObjectFactoryInitializationException {
        final var factory = ObjectFactory.create(new RosterModule(), new TestModule(temp));
        assertThatThrownBy(() -> factory.get(StudentSorter.class)).isInstanceOf(IllegalStateException.class);
        factory.initialize();
        assertThatThrownBy(factory::initialize).isInstanceOf(IllegalStateException.class);
    }

    private record TestModule(Path directory) implements ObjectModule {

        @Override
        public void configure(final ObjectBinder binder) {
            binder.bind(Path.class).named("directory").toInst(this.directory);
        }
    }
}
