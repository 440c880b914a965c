package com.xpdustry.roster.common.factory;

@FunctionalInterface
public interface ObjectModule {

    void configure(final ObjectBinder binder);
}
