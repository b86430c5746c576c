package com.layeredcraft.cdk.utils;

import software.amazon.awscdk.services.lambda.Architecture;

public class ResourceNameUtils {

    /** Account that publishes the AWS Distro for OpenTelemetry collector layers. */
    public static final String OTEL_LAYER_ACCOUNT = "901920570463";

    public static String buildSiteDomainName(String siteSubDomain, String domainName) {
        if (siteSubDomain == null || siteSubDomain.isBlank()) {
            throw new IllegalArgumentException("siteSubDomain must be non-empty");
        }
        if (domainName == null || domainName.isBlank()) {
            throw new IllegalArgumentException("domainName must be non-empty");
        }
        return "%s.%s".formatted(siteSubDomain, domainName);
    }

    public static String buildFunctionName(String functionName, String functionSuffix) {
        if (functionName == null || functionName.isBlank()) {
            throw new IllegalArgumentException("Function name cannot be null or blank");
        }
        if (functionSuffix == null || functionSuffix.isBlank()) {
            throw new IllegalArgumentException("Function suffix cannot be null or blank");
        }
        return "%s-%s".formatted(functionName, functionSuffix);
    }

    public static String buildLambdaLogGroupName(String fullFunctionName) {
        return "/aws/lambda/%s".formatted(fullFunctionName);
    }

    /**
     * Log group ARN pattern covering the function's log group and its streams.
     * e.g. arn:aws:logs:eu-west-2:111111111111:log-group:/aws/lambda/orders-dev*:*
     *
     * @param streamLevel when true the pattern also matches individual log streams (":*:*"),
     *     which is what logs:PutLogEvents is authorised against
     */
    public static String buildLambdaLogGroupArnPattern(
            String region, String account, String fullFunctionName, boolean streamLevel) {
        return "arn:aws:logs:%s:%s:log-group:%s*:*%s"
                .formatted(region, account, buildLambdaLogGroupName(fullFunctionName), streamLevel ? ":*" : "");
    }

    public static String buildOtelLayerArn(String region, Architecture architecture, String otelLayerVersion) {
        return "arn:aws:lambda:%s:%s:layer:aws-otel-collector-%s-ver-%s:1"
                .formatted(region, OTEL_LAYER_ACCOUNT, otelArchitectureName(architecture), otelLayerVersion);
    }

    /** The collector layers are published as amd64 and arm64 rather than Lambda's x86_64 / arm64. */
    public static String otelArchitectureName(Architecture architecture) {
        return Architecture.ARM_64.getName().equals(architecture.getName()) ? "arm64" : "amd64";
    }

    public static String buildDynamoDbTableArn(String region, String account, String tableName) {
        return "arn:aws:dynamodb:%s:%s:table/%s".formatted(region, account, tableName);
    }

    public static String buildS3ObjectsArn(String bucketName) {
        return "arn:aws:s3:::%s/*".formatted(bucketName);
    }

    public static String buildStreamMappingId(String tableName) {
        return "%s-stream-mapping".formatted(tableName);
    }

    public static String buildIndexedId(String idPrefix, String kind, int index) {
        return "%s-%s-%d".formatted(idPrefix, kind, index);
    }
}
