package com.williamcallahan.aivisibility.logging;

import com.williamcallahan.aivisibility.domain.analysis.PageResult;
import java.util.concurrent.CompletableFuture;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Logging aspect for the analysis pipeline.
 * Times each page job and each double-checked analysis on the PIPELINE logger.
 */
@Aspect
@Component
public class AnalysisPipelineLogger {
    private static final Logger PIPELINE_LOG = LoggerFactory.getLogger("PIPELINE");

    /**
     * Log page job outcome
     */
    @Around("execution(* com.williamcallahan.aivisibility.service.PageJobRunner.run(..))")
    public Object logPageJob(ProceedingJoinPoint joinPoint) throws Throwable {
        Object url = joinPoint.getArgs()[0];
        long startTime = System.currentTimeMillis();

        PIPELINE_LOG.info("[{}] PAGE JOB - Starting", url);
        try {
            Object result = joinPoint.proceed();
            long duration = System.currentTimeMillis() - startTime;

            if (result instanceof PageResult pageResult) {
                if (pageResult.hasAnalysis()) {
                    PIPELINE_LOG.info("[{}] PAGE JOB - Succeeded with score {} after {} attempt(s) in {}ms",
                        url, pageResult.score(), pageResult.attempts(), duration);
                } else {
                    PIPELINE_LOG.info("[{}] PAGE JOB - Failed [{}] after {} attempt(s) in {}ms",
                        url, pageResult.errorType(), pageResult.attempts(), duration);
                }
            }
            return result;
        } catch (Exception e) {
            PIPELINE_LOG.error("[{}] PAGE JOB - Escaped with error: {}", url, e.getMessage());
            throw e;
        }
    }

    /**
     * Log double-check duration once both runs settle
     */
    @Around("execution(* com.williamcallahan.aivisibility.service.ConsistencyResolver.analyzeAsync(..))")
    public Object logDoubleCheck(ProceedingJoinPoint joinPoint) throws Throwable {
        Object url = joinPoint.getArgs()[0];
        long startTime = System.currentTimeMillis();

        PIPELINE_LOG.info("[{}] DOUBLE CHECK - Starting two analyzer runs", url);
        Object result = joinPoint.proceed();
        if (result instanceof CompletableFuture<?> pending) {
            pending.whenComplete((ignored, failure) -> {
                long duration = System.currentTimeMillis() - startTime;
                if (failure == null) {
                    PIPELINE_LOG.info("[{}] DOUBLE CHECK - Completed in {}ms", url, duration);
                } else {
                    PIPELINE_LOG.warn("[{}] DOUBLE CHECK - Failed after {}ms: {}", url, duration, failure.getMessage());
                }
            });
        }
        return result;
    }
}
