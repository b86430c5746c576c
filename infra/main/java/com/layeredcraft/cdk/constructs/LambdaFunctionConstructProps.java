package com.layeredcraft.cdk.constructs;

import java.util.List;
import java.util.Map;
import org.immutables.value.Value;
import software.amazon.awscdk.services.iam.PolicyStatement;
import software.amazon.awscdk.services.lambda.Architecture;

/**
 * Properties for a {@link LambdaFunctionConstruct}.
 *
 * The deployed function is named {@code {functionName}-{functionSuffix}}; the suffix usually carries
 * the environment (e.g. "dev", "prod").
 */
@Value.Immutable
public interface LambdaFunctionConstructProps {

    String functionName();

    String functionSuffix();

    /** Directory or zip containing the {@code bootstrap} executable */
    String assetPath();

    String roleName();

    String policyName();

    /** Appended to the CloudWatch Logs statements of the function's inline policy */
    List<PolicyStatement> policyStatements();

    Map<String, String> environmentVariables();

    /** Adds the ADOT collector layer and turns on active tracing */
    @Value.Default
    default boolean includeOtelLayer() {
        return true;
    }

    List<LambdaPermission> permissions();

    @Value.Default
    default boolean enableSnapStart() {
        return false;
    }

    /** Memory size in MB */
    @Value.Default
    default int memorySize() {
        return 1024;
    }

    @Value.Default
    default int timeoutInSeconds() {
        return 6;
    }

    @Value.Default
    default Architecture architecture() {
        return Architecture.X86_64;
    }

    @Value.Default
    default String otelLayerVersion() {
        return "0-102-1";
    }

    /** Adds a public (auth NONE) function URL to the live alias */
    @Value.Default
    default boolean generateUrl() {
        return false;
    }

    static ImmutableLambdaFunctionConstructProps.Builder builder() {
        return ImmutableLambdaFunctionConstructProps.builder();
    }
}
