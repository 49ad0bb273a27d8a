package com.fhi.my_pets.service.exception;

import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;

/**
 * Boundary of every public service operation.
 *
 * <p>{@link ServiceException}s are expected failures (not found, invalid argument...) and
 * pass through untouched. Anything else is logged with its stack trace and re-thrown as a
 * {@link ServiceException.Cause#INTERNAL} failure whose message says nothing about the cause.</p>
 *
 * <p>Highest precedence puts this aspect outside the transaction interceptor, so that
 * failures at commit time are caught too.</p>
 */
@Aspect
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
@Slf4j
public class ServiceBoundaryAspect
{
    @Around("execution(public * com.fhi.my_pets.service.*Service.*(..))")
    public Object guard(ProceedingJoinPoint joinPoint) throws Throwable
    {
        try
        {   return joinPoint.proceed();
        }
        catch (ServiceException e)
        {   log.debug("[{}] {}", joinPoint.getSignature().toShortString(), e.toString());
            throw e;
        }
        catch (RuntimeException e)
        {   log.error("Unexpected failure in [{}]", joinPoint.getSignature().toShortString(), e);
            throw ServiceException.internal(e);
        }
    }
}
