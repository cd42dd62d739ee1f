package com.realestate.compatibility.aspect;

import com.realestate.compatibility.dto.CompatibilityAuditRequest;
import com.realestate.compatibility.dto.CompatibilityAuditResponse;
import com.realestate.compatibility.service.RunLogService;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.JoinPoint;
import org.aspectj.lang.annotation.AfterReturning;
import org.aspectj.lang.annotation.AfterThrowing;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.annotation.Before;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Records every compatibility audit run, its outcome and its requester in the run log.
 */
@Aspect
@Component
@Slf4j
public class RunLogAspect {

    private static final String AUDIT_METHODS =
            "execution(* com.realestate.compatibility.service.CompatibilityAuditService.audit*(..))";

    @Autowired
    private RunLogService runLogService;

    @Before(AUDIT_METHODS)
    public void beforeAudit(JoinPoint joinPoint) {
        record("COMPATIBILITY_AUDIT_REQUEST", "Requested " + describe(joinPoint), joinPoint);
    }

    @AfterReturning(pointcut = AUDIT_METHODS, returning = "response")
    public void afterAuditSuccess(JoinPoint joinPoint, CompatibilityAuditResponse response) {
        String details = String.format(
                "Completed %s: %d parcels, %d adjacent pairs, %d warnings, %d ms",
                describe(joinPoint),
                response.getParcelCount(),
                response.getAdjacentPairCount(),
                response.getWarnings() != null ? response.getWarnings().size() : 0,
                response.getElapsedMillis());
        record("COMPATIBILITY_AUDIT_SUCCESS", details, joinPoint);
    }

    @AfterThrowing(pointcut = AUDIT_METHODS, throwing = "exception")
    public void afterAuditFailure(JoinPoint joinPoint, Exception exception) {
        String details = String.format("Failed %s. Error: %s",
                describe(joinPoint),
                exception.getMessage() != null ? exception.getMessage() : exception.getClass().getSimpleName());
        record("COMPATIBILITY_AUDIT_FAILURE", details, joinPoint);
    }

    private void record(String action, String details, JoinPoint joinPoint) {
        try {
            runLogService.logRunEvent(action, details, username(joinPoint.getArgs()));
        } catch (RuntimeException e) {
            log.warn("Could not record {} in run log", action, e);
        }
    }

    private static String describe(JoinPoint joinPoint) {
        Object[] args = joinPoint.getArgs();
        if (args.length > 0 && args[0] instanceof CompatibilityAuditRequest) {
            CompatibilityAuditRequest request = (CompatibilityAuditRequest) args[0];
            return String.format("audit of submitted parcels (distance %s, land use field '%s')",
                    request.getAdjacencyDistance() != null ? request.getAdjacencyDistance() : "default",
                    request.getLandUseField() != null ? request.getLandUseField() : "default");
        }
        if (args.length >= 2) {
            return String.format("audit of stored parcels (distance %s, land use field '%s')",
                    args[0] != null ? args[0] : "default",
                    args[1] != null ? args[1] : "land_use");
        }
        return joinPoint.getSignature().getName();
    }

    private static String username(Object[] args) {
        String username = null;
        if (args.length > 0 && args[0] instanceof CompatibilityAuditRequest) {
            username = ((CompatibilityAuditRequest) args[0]).getUsername();
        } else if (args.length >= 3 && args[2] instanceof String) {
            username = (String) args[2];
        }
        return username != null && !username.isBlank() ? username : "anonymous";
    }
}
