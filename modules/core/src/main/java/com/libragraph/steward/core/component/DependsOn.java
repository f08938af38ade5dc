package com.libragraph.steward.core.component;

import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.TYPE;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Declares that a {@link ManagedComponent} depends on another component. On shutdown the
 * dependent is stopped (or forcefully removed) before the component it depends on.
 */
@Target(TYPE)
@Retention(RUNTIME)
@Repeatable(DependsOn.List.class)
public @interface DependsOn {

    Class<? extends ManagedComponent> value();

    @Target(TYPE)
    @Retention(RUNTIME)
    @interface List {
        DependsOn[] value();
    }
}
