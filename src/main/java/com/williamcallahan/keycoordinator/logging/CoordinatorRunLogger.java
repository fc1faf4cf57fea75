package com.williamcallahan.keycoordinator.logging;

import com.williamcallahan.keycoordinator.service.retry.FinalFailureException;
import com.williamcallahan.keycoordinator.service.retry.RetryOptions;
import java.util.UUID;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

/**
 * Tags each coordinated run with a run id in the MDC and logs its outcome and duration.
 */
@Aspect
@Component
public class CoordinatorRunLogger {
    private static final Logger COORDINATOR_LOG = LoggerFactory.getLogger("COORDINATOR");

    /** MDC key carrying the run id for every log line emitted during a run. */
    public static final String RUN_ID_KEY = "coordinatorRun";

    private static final int RUN_ID_LENGTH = 8;

    @Around("execution(* com.williamcallahan.keycoordinator.service.retry.RetryCoordinator.executeWithRetry(..))")
    public Object logCoordinatedRun(ProceedingJoinPoint joinPoint) throws Throwable {
        String previousRunId = MDC.get(RUN_ID_KEY);
        String runId = "RUN-" + UUID.randomUUID().toString().substring(0, RUN_ID_LENGTH);
        MDC.put(RUN_ID_KEY, runId);
        String label = describe(joinPoint.getArgs());
        long startTime = System.currentTimeMillis();

        COORDINATOR_LOG.info("[{}] {} - Starting", runId, label);
        try {
            Object result = joinPoint.proceed();
            COORDINATOR_LOG.info("[{}] {} - Completed in {}ms",
                    runId, label, System.currentTimeMillis() - startTime);
            return result;
        } catch (FinalFailureException finalFailure) {
            COORDINATOR_LOG.error("[{}] {} - Exhausted after {} attempt(s) in {}ms ({})",
                    runId, label, finalFailure.attemptsMade(), System.currentTimeMillis() - startTime,
                    finalFailure.notice());
            throw finalFailure;
        } catch (Exception e) {
            COORDINATOR_LOG.error("[{}] {} - Failed: {}", runId, label, e.getMessage());
            throw e;
        } finally {
            if (previousRunId == null) {
                MDC.remove(RUN_ID_KEY);
            } else {
                MDC.put(RUN_ID_KEY, previousRunId);
            }
        }
    }

    private static String describe(Object[] args) {
        for (Object arg : args) {
            if (arg instanceof RetryOptions options) {
                return options.provider().getName() + " " + options.operation();
            }
        }
        return "coordinated run";
    }
}
