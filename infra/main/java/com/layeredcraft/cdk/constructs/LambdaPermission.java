package com.layeredcraft.cdk.constructs;

import java.util.Optional;
import org.immutables.value.Value;

/**
 * An invoke permission granted to the function, its current version and its live alias.
 */
@Value.Immutable
public interface LambdaPermission {

    /** Service principal, e.g. "apigateway.amazonaws.com" */
    String principal();

    /** e.g. "lambda:InvokeFunction" */
    String action();

    Optional<String> eventSourceToken();

    Optional<String> sourceArn();

    static ImmutableLambdaPermission.Builder builder() {
        return ImmutableLambdaPermission.builder();
    }
}
