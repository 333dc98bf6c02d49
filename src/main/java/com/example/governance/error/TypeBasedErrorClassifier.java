package com.example.governance.error;

import com.example.governance.infra.resilience.FailureClassifier;

import java.util.EnumSet;
import java.util.Set;

/**
 * Fallback {@link ErrorClassifier}: types the throwable with {@link FailureClassifier} and
 * derives severity, impact scope and retryability from the type alone. Deployments with a
 * real classification service register their own {@link ErrorClassifier} bean instead.
 */
public class TypeBasedErrorClassifier implements ErrorClassifier {

    private static final Set<ErrorType> NON_RETRYABLE = EnumSet.of(
            ErrorType.VALIDATION_ERROR,
            ErrorType.AUTHORIZATION_ERROR,
            ErrorType.DATA_CORRUPTION_ERROR,
            ErrorType.CONFIGURATION_ERROR,
            ErrorType.BUSINESS_LOGIC_ERROR);

    @Override
    public ErrorClassification classify(Throwable error, ErrorContext context) {
        ErrorType type = FailureClassifier.classify(error);
        ErrorSeverity severity = severityOf(type);
        ImpactScope scope = scopeOf(type);
        boolean immediate = severity.isAtLeast(ErrorSeverity.CRITICAL)
                || scope == ImpactScope.SYSTEM_WIDE
                || scope == ImpactScope.CROSS_SYSTEM
                || (severity == ErrorSeverity.HIGH && scope == ImpactScope.AGENT_CLUSTER);
        return ErrorClassification.of(type, severity, scope)
                .withRetryable(!NON_RETRYABLE.contains(type))
                .withImmediateAttention(immediate);
    }

    static ErrorSeverity severityOf(ErrorType type) {
        return switch (type) {
            case SYSTEM_ERROR, DATA_CORRUPTION_ERROR -> ErrorSeverity.CRITICAL;
            case DATABASE_ERROR, AGENT_COORDINATION_ERROR -> ErrorSeverity.HIGH;
            case VALIDATION_ERROR, AUTHENTICATION_ERROR -> ErrorSeverity.LOW;
            default -> ErrorSeverity.MEDIUM;
        };
    }

    static ImpactScope scopeOf(ErrorType type) {
        return switch (type) {
            case SYSTEM_ERROR, RESOURCE_EXHAUSTION -> ImpactScope.SYSTEM_WIDE;
            case AGENT_COORDINATION_ERROR, DATABASE_ERROR -> ImpactScope.AGENT_CLUSTER;
            case DEPENDENCY_ERROR -> ImpactScope.CROSS_SYSTEM;
            case VALIDATION_ERROR, AUTHENTICATION_ERROR, AUTHORIZATION_ERROR -> ImpactScope.SINGLE_AGENT;
            default -> ImpactScope.SINGLE_REQUEST;
        };
    }
}
