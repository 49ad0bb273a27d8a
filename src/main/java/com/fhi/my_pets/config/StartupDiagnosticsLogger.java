package com.fhi.my_pets.config;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.util.Arrays;


/**
 * Logs the effective profiles, database and translation settings at startup.
 *
 * <p>Only active with:
 * <pre>
 *   app.startup-diagnostics-logger.enabled=true
 * </pre>
 * which the "local" and "test" profiles set.</p>
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "app.startup-diagnostics-logger.enabled", havingValue = "true", matchIfMissing = false)
public class StartupDiagnosticsLogger
{
   private static final String PREFIX = "[Startup Diagnostics]";

   private final Environment environment;

   @Value("${spring.liquibase.contexts:__UNSET__}")
   private String liquibaseContexts;


   public StartupDiagnosticsLogger(Environment environment)
   {  this.environment = environment;
   }


   @PostConstruct
   public void logDebugInfo()
   {
      log.info("{} Diagnostics mode is ON", PREFIX);

      log.info("{} Active Spring profiles              : {}", PREFIX, Arrays.toString(environment.getActiveProfiles()));
      log.info("{} Liquibase contexts                  : {}", PREFIX, liquibaseContexts);
      log.info("{} Property: spring.datasource.url     = {}", PREFIX, environment.getProperty("spring.datasource.url", "NOT SET"));
      log.info("{} Property: app.translation.base-url  = {}", PREFIX, environment.getProperty("app.translation.base-url", "NOT SET"));
      log.info("{} Property: app.translation.langpair  = {}|{}", PREFIX,
               environment.getProperty("app.translation.source-lang", "en"),
               environment.getProperty("app.translation.target-lang", "fr"));
      log.info("{} Property: app.pagination.max-limit  = {}", PREFIX, environment.getProperty("app.pagination.max-limit", "NOT SET"));
   }
}
