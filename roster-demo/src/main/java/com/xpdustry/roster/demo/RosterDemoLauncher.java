package com.xpdustry.roster.demo;

import com.xpdustry.roster.common.RosterModule;
import com.xpdustry.roster.common.factory.ObjectFactory;
import com.xpdustry.roster.common.factory.ObjectFactoryInitializationException;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class RosterDemoLauncher {

    private static final Logger LOGGER = LoggerFactory.getLogger(RosterDemoLauncher.class);

    public static void main(final String[] ignored) {
        final var factory = ObjectFactory.create(
                new RosterModule(),
                binder -> binder.bind(Path.class).named("directory").toInst(Path.of("").toAbsolutePath()));

        try {
            factory.initialize();
        } catch (final ObjectFactoryInitializationException e) {
            LOGGER.error("Failed to initialize the roster demo", e);
            System.exit(1);
            return;
        }

        System.out.println("Roster demo");
        factory.get(RosterDemo.class).run(System.out);
        System.out.println();
        System.out.println("Demo finished.");
        LOGGER.info("Roster demo finished.");
    }
}
