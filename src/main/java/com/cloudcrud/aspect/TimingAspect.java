package com.cloudcrud.aspect;

import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.stereotype.Component;

/**
 * Logs the execution time of methods annotated with {@link Timed}
 */
@Aspect
@Component
@Slf4j
public class TimingAspect {

    @Around("@annotation(timed)")
    public Object measureExecutionTime(ProceedingJoinPoint joinPoint, Timed timed) throws Throwable {
        long startTime = System.currentTimeMillis();
        String operation = describe(joinPoint, timed);

        try {
            Object result = joinPoint.proceed();
            long duration = System.currentTimeMillis() - startTime;

            if (timed.logLevel() == Timed.LogLevel.INFO) {
                log.info("{} executed in {}ms", operation, duration);
            } else {
                log.debug("{} executed in {}ms", operation, duration);
            }

            return result;
        } catch (Exception e) {
            long duration = System.currentTimeMillis() - startTime;
            log.debug("{} failed after {}ms: {}", operation, duration, e.getMessage());
            throw e;
        }
    }

    private String describe(ProceedingJoinPoint joinPoint, Timed timed) {
        if (!timed.value().isEmpty()) {
            return timed.value();
        }
        return joinPoint.getSignature().getDeclaringType().getSimpleName() + "#" + joinPoint.getSignature().getName();
    }
}
