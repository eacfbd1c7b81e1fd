package com.awsmap.aws;

import com.awsmap.inventory.collector.CollectorException;
import com.awsmap.inventory.collector.CollectorFailure;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkException;

import java.net.UnknownHostException;
import java.util.Set;

/**
 * Maps SDK exceptions onto {@link CollectorFailure} kinds.
 */
public final class AwsErrors {

    private static final Set<String> ACCESS_DENIED_CODES = Set.of(
            "AccessDenied", "AccessDeniedException", "UnauthorizedOperation", "UnauthorizedException",
            "AuthorizationError", "AuthFailure");

    private static final Set<String> UNSUPPORTED_REGION_CODES = Set.of(
            "InvalidClientTokenId", "UnrecognizedClientException", "OptInRequired", "SubscriptionRequiredException");

    private AwsErrors() {
    }

    public static CollectorException translate(String service, String region, SdkException ex) {
        CollectorFailure failure = classify(ex);
        String message = describe(ex);
        return new CollectorException(failure, service + " in " + region + ": " + message, ex);
    }

    static CollectorFailure classify(SdkException ex) {
        if (ex instanceof AwsServiceException service) {
            if (service.isThrottlingException()) {
                return CollectorFailure.THROTTLED;
            }
            String code = service.awsErrorDetails() != null ? service.awsErrorDetails().errorCode() : null;
            if (code != null && ACCESS_DENIED_CODES.contains(code)) {
                return CollectorFailure.ACCESS_DENIED;
            }
            // Opt-in regions reject the credentials instead of answering.
            if (code != null && UNSUPPORTED_REGION_CODES.contains(code)) {
                return CollectorFailure.UNSUPPORTED_REGION;
            }
            if (service.statusCode() == 403) {
                return CollectorFailure.ACCESS_DENIED;
            }
            if (service.statusCode() >= 500) {
                return CollectorFailure.TRANSIENT;
            }
            return CollectorFailure.PROVIDER_ERROR;
        }
        if (ex instanceof SdkClientException) {
            return hasCause(ex, UnknownHostException.class) ? CollectorFailure.UNSUPPORTED_REGION : CollectorFailure.TRANSIENT;
        }
        return CollectorFailure.PROVIDER_ERROR;
    }

    private static String describe(SdkException ex) {
        if (ex instanceof AwsServiceException service && service.awsErrorDetails() != null
                && service.awsErrorDetails().errorMessage() != null) {
            return service.awsErrorDetails().errorMessage();
        }
        return ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
    }

    private static boolean hasCause(Throwable ex, Class<? extends Throwable> type) {
        for (Throwable cause = ex; cause != null; cause = cause.getCause()) {
            if (type.isInstance(cause)) {
                return true;
            }
        }
        return false;
    }
}
