package com.fhi.my_pets.tools;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import lombok.extern.slf4j.Slf4j;
import net.ttddyy.dsproxy.ExecutionInfo;
import net.ttddyy.dsproxy.QueryInfo;
import net.ttddyy.dsproxy.listener.QueryExecutionListener;

/**
 * Logs every SQL statement going through the proxied datasource, with its execution time
 * and the first MyPets method found on the stack (e.g. {@code PetService:findPets:58}).
 *
 * <p>Handy to spot the extra queries of the statistics endpoints, which read the whole
 * pet table, or a lookup that unexpectedly runs twice.
 */
@Slf4j
public class ProfilingQueryExecutionListener implements QueryExecutionListener
{
   private final boolean enabled;

   /**
    * Prefix of every log line, to grep them out.
    */
   private final String logLinePrefix;

   /**
    * Infrastructure layers skipped when looking for the application caller.
    */
    private static final List<String> IGNORED_PACKAGES = List.of(
        "java.",
        "jakarta.",
        "org.springframework.",
        "org.hibernate.",
        "com.zaxxer.",
        "net.ttddyy.",
        "ch.qos.logback."
    );

    /**
     * Our own classes that never are the interesting caller.
     */
    private static final List<String> IGNORED_CLASSES = List.of(
        ProfilingQueryExecutionListener.class.getName(),
        PerformanceProfiler.class.getName(),
        "com.fhi.my_pets.service.exception.ServiceBoundaryAspect"
    );


   private static final String APP_PACKAGE_START = "com.fhi.my_pets";


    public ProfilingQueryExecutionListener(boolean enabled, String logLinePrefix)
    {   this.enabled = enabled;
        this.logLinePrefix = logLinePrefix;
    }


    @Override
    public void afterQuery(ExecutionInfo execInfo, List<QueryInfo> queryInfoList)
    {
      if (!enabled) return;

      String combinedSql = queryInfoList.stream()
                                        .map(QueryInfo::getQuery)
                                        .collect(Collectors.joining("\n"));

      StackTraceElement caller = findApplicationCaller()
                                 .orElse(new StackTraceElement("unknown", "unknown", "unknown", -1));

      log.info("{} in [{}:{}:{}], executed SQL request in {} ms{}: \n{}",
               logLinePrefix,
               simpleName(caller.getClassName()),
               caller.getMethodName(),
               caller.getLineNumber(),
               execInfo.getElapsedTime(),
               execInfo.isSuccess() ? "" : " (FAILED)",
               combinedSql);
    }


   /**
    * @return the first stack frame in application code, proxies and this listener excluded
    */
   private Optional<StackTraceElement> findApplicationCaller()
   {
      return Arrays.stream(Thread.currentThread().getStackTrace())
                   .filter(element -> {
                                        String className = element.getClassName();
                                        return     className.startsWith(APP_PACKAGE_START)
                                                && !shouldIgnoreClass(className);
                   })
                   .findFirst();
   }

    private boolean shouldIgnoreClass(String className)
    {
        return     IGNORED_PACKAGES.stream().anyMatch(className::startsWith)
                || IGNORED_CLASSES.contains(className)
                || className.contains("$$");   // CGLIB proxies
    }

    /**
     * "com.fhi.my_pets.service.PetService" => "PetService". Works on the name alone: the class
     * may not be visible to this class loader.
     */
    static String simpleName(String className)
    {   return className.substring(className.lastIndexOf('.') + 1);
    }


    @Override
    public void beforeQuery(ExecutionInfo execInfo, List<QueryInfo> queryInfoList)
    {
        // Nothing to do before execution
    }
}
