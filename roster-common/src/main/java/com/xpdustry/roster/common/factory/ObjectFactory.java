package com.xpdustry.roster.common.factory;

import org.jspecify.annotations.Nullable;

public interface ObjectFactory {

    static ObjectFactory create(final ObjectModule... modules) {
        return new GuiceObjectFactory(modules);
    }

    void initialize() throws ObjectFactoryInitializationException;

    <T> T get(final Class<T> type, final @Nullable String name);

    default <T> T get(final Class<T> type) {
        return get(type, null);
    }
}
