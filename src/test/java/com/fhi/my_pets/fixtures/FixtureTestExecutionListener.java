package com.fhi.my_pets.fixtures;

import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.test.context.TestContext;
import org.springframework.test.context.support.AbstractTestExecutionListener;
import org.springframework.transaction.annotation.Transactional;

import lombok.extern.slf4j.Slf4j;


/**
 * Loads the {@link Fixtures} of the test class before each test method.
 *
 * <p>Runs after Spring's transactional listener, so the fixture rows are inserted in the
 * test method's transaction and rolled back with it.</p>
 */
@Slf4j
public class FixtureTestExecutionListener extends AbstractTestExecutionListener
{
    @Override
    public void beforeTestMethod(TestContext testContext) throws Exception
    {
        Class<?> testClass = testContext.getTestClass();
        Fixtures fixtures = AnnotatedElementUtils.findMergedAnnotation(testClass, Fixtures.class);
        if (fixtures == null) return;

        if (!AnnotatedElementUtils.hasAnnotation(testClass, Transactional.class))
        {   log.warn("@Transactional is missing on test class {} which uses @Fixtures: fixture rows will leak into other tests.",
                     testClass.getSimpleName());
        }

        FixtureLoader loader = testContext.getApplicationContext().getBean(FixtureLoader.class);
        log.debug("Loading [{}] for {}", fixtures.value(), testClass.getSimpleName());
        loader.load(fixtures.value(), testClass.getSimpleName());
    }
}
