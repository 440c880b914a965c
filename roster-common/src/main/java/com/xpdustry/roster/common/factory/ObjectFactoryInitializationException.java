package com.xpdustry.roster.common.factory;

@SuppressWarnings("serial")
public final class ObjectFactoryInitializationException extends Exception {

    public ObjectFactoryInitializationException(final Exception cause) {
        super(cause);
    }
}
