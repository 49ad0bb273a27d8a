package com.fhi.my_pets.tools;

import java.util.Arrays;

import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.hibernate.SessionFactory;
import org.hibernate.stat.Statistics;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import jakarta.persistence.EntityManagerFactory;
import lombok.extern.slf4j.Slf4j;

/**
 * Service-level profiler: for every call to a {@code *Service} method, logs its duration and the
 * Hibernate statistics it produced (queries, entities and collections loaded).
 *
 * <p>Complements {@link ProfilingQueryExecutionListener}, which works one SQL statement at a time.
 *
 * <p>Hibernate statistics are global to the session factory, so figures are only exact when a
 * single request runs at a time: fine locally and in tests, which is where this is switched on
 * ({@code profiling.performance.enabled}).
 */
@Aspect
@Component
@Slf4j
public class PerformanceProfiler
{
    @Value("${profiling.performance.enabled:false}")
    private boolean profilerEnabled;

    @Value("${profiling.performance.slowCallThreshold:500}")
    private long slowCallThreshold;

    @Value("${profiling.performance.queryCountThreshold:50}")
    private long queryCountThreshold;

    @Value("${profiling.performance.printQueryThreshold:5}")
    private long printQueryThreshold;

    @Value("${profiling.performance.logLinePrefix:PROFILING---}")
    private String logLinePrefix;

    private final SessionFactory sessionFactory;


    public PerformanceProfiler(EntityManagerFactory entityManagerFactory)
    {   this.sessionFactory = entityManagerFactory.unwrap(SessionFactory.class);
    }

    @PostConstruct
    public void init()
    {
        if (!profilerEnabled)
        {   return;
        }
        if (!sessionFactory.getStatistics().isStatisticsEnabled())
        {   log.warn("Hibernate statistics are NOT enabled. Enable them via 'hibernate.generate_statistics: true'.");
        } else
        {   log.info("Hibernate statistics are enabled for profiling.");
        }
    }


    @Around("execution(public * com.fhi.my_pets.service.*Service.*(..))")
    public Object profile(ProceedingJoinPoint joinPoint) throws Throwable
    {
        if (!profilerEnabled)
        {   return joinPoint.proceed();
        }

        Statistics stats = sessionFactory.getStatistics();
        stats.clear();
        long start = System.currentTimeMillis();
        try
        {   return joinPoint.proceed();
        }
        finally
        {
            long duration            = System.currentTimeMillis() - start;
            long queryCount          = stats.getQueryExecutionCount();
            long entityLoadCount     = stats.getEntityLoadCount();
            // High collection load counts point at lazy collections loaded in a loop
            long collectionLoadCount = stats.getCollectionLoadCount();
            String method            = joinPoint.getSignature().toShortString();

            log.info("{} [{} ms; {} queries; {} entities, {} collections] for [{}]",
                     logLinePrefix, duration, queryCount, entityLoadCount, collectionLoadCount, method);

            if (queryCount > printQueryThreshold)
            {   log.debug("{} queries of [{}]: {}", logLinePrefix, method, Arrays.asList(stats.getQueries()));
            }
            if (duration > slowCallThreshold)
            {   log.warn("{} SLOW CALL DETECTED: [{}] took {} ms", logLinePrefix, method, duration);
            }
            if (queryCount > queryCountThreshold)
            {   log.warn("{} HIGH QUERY COUNT DETECTED: [{}] generated {} queries", logLinePrefix, method, queryCount);
            }
        }
    }
}
