package com.fhi.my_pets.fixtures;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.TestInstance;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.TestExecutionListeners;
import org.springframework.transaction.annotation.Transactional;


/**
 * Meta-annotation for Spring Boot integration tests with fixture-based data loading.
 *
 * This annotation:
 * - Boots the full Spring application context ("test" profile), shared between test classes
 * - Configures MockMvc for the REST endpoints
 * - Rolls back every test method's transaction, fixture rows included
 * - Registers {@link FixtureTestExecutionListener} to load {@link Fixtures} before each test method
 *
 * Run only these with:
 * $ mvn test -Dgroups=SpringIntegrationTest
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@SpringBootTest
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
@AutoConfigureMockMvc
@Transactional

// mergeMode keeps Spring Boot's default listeners (transactions, mocks...)
@TestExecutionListeners(
    value = FixtureTestExecutionListener.class,
    mergeMode = TestExecutionListeners.MergeMode.MERGE_WITH_DEFAULTS
)
@Import(FixtureLoader.class)
@Tag("SpringIntegrationTest")
public @interface SpringIntegrationTest
{}
