package com.fhi.my_pets.fixtures;

import java.lang.annotation.*;

/**
 * Declares the owners (with their nested pets) to insert before each test method of a
 * {@link SpringIntegrationTest} class.
 *
 * <p>The file is looked up first in {@code fixtures/tests/<TestClassSimpleName>/}, then in
 * {@code fixtures/shared/}, on the test classpath:</p>
 * <pre>{@code
 *    @SpringIntegrationTest
 *    @Fixtures                          // fixtures/shared/owners.json
 *    class OwnerServiceTest { ... }
 * }</pre>
 *
 * <p>Loaded rows live in the test method's transaction and are rolled back with it.
 * Loaded entities are available through {@link FixtureLoader#owner(int)} and
 * {@link FixtureLoader#pet(int, int)}.</p>
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Inherited
public @interface Fixtures
{
    /**
     * Name of the fixture file.
     */
    String value() default "owners.json";
}
