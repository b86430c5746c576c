package com.layeredcraft.cdk.testing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class LambdaFunctionConstructPropsBuilderTest {

    @Test
    void defaults() {
        var props = new LambdaFunctionConstructPropsBuilder().build();

        assertEquals("test-function", props.functionName());
        assertEquals("./test-lambda.zip", props.assetPath());
        assertEquals(1024, props.memorySize());
        assertEquals(6, props.timeoutInSeconds());
        assertTrue(props.includeOtelLayer());
        assertFalse(props.enableSnapStart());
        assertFalse(props.generateUrl());
        assertTrue(props.policyStatements().isEmpty());
        assertTrue(props.permissions().isEmpty());
    }

    @Test
    void accessShortcutsAddPolicyStatements() {
        var props = new LambdaFunctionConstructPropsBuilder()
                .withDynamoDbAccess("orders", "eu-west-2", "111111111111")
                .withS3Access("uploads", List.of("s3:GetObject"))
                .build();

        assertEquals(2, props.policyStatements().size());
        var dynamo = props.policyStatements().get(0);
        assertEquals(LambdaFunctionConstructPropsBuilder.DEFAULT_DYNAMODB_ACTIONS, dynamo.getActions());
        assertEquals(List.of("arn:aws:dynamodb:eu-west-2:111111111111:table/orders"), dynamo.getResources());
        var s3 = props.policyStatements().get(1);
        assertEquals(List.of("s3:GetObject"), s3.getActions());
        assertEquals(List.of("arn:aws:s3:::uploads/*"), s3.getResources());
    }

    @Test
    void invokePermissions() {
        var props = new LambdaFunctionConstructPropsBuilder()
                .withApiGatewayPermission("arn:aws:execute-api:eu-west-2:111111111111:api/*")
                .withAlexaPermission("amzn1.ask.skill.1")
                .build();

        var apiGateway = props.permissions().get(0);
        assertEquals("apigateway.amazonaws.com", apiGateway.principal());
        assertEquals("lambda:InvokeFunction", apiGateway.action());
        assertEquals(Optional.of("arn:aws:execute-api:eu-west-2:111111111111:api/*"), apiGateway.sourceArn());
        assertEquals(Optional.empty(), apiGateway.eventSourceToken());

        var alexa = props.permissions().get(1);
        assertEquals("alexa-appkit.amazon.com", alexa.principal());
        assertEquals(Optional.of("amzn1.ask.skill.1"), alexa.eventSourceToken());
        assertEquals(Optional.empty(), alexa.sourceArn());
    }

    @Test
    void apiGatewayPermissionWithoutSourceArn() {
        var props = new LambdaFunctionConstructPropsBuilder()
                .withApiGatewayPermission(null, "token")
                .build();

        var permission = props.permissions().get(0);
        assertEquals(Optional.empty(), permission.sourceArn());
        assertEquals(Optional.of("token"), permission.eventSourceToken());
    }

    @Test
    void environmentVariablesAccumulate() {
        var props = new LambdaFunctionConstructPropsBuilder()
                .withEnvironmentVariable("A", "1")
                .withEnvironmentVariables(Map.of("B", "2"))
                .withEnvironmentVariable("A", "3")
                .withSnapStart(true)
                .withMemorySize(256)
                .withTimeoutInSeconds(15)
                .withGenerateUrl(true)
                .build();

        assertEquals(Map.of("A", "3", "B", "2"), props.environmentVariables());
        assertTrue(props.enableSnapStart());
        assertEquals(256, props.memorySize());
        assertEquals(15, props.timeoutInSeconds());
        assertTrue(props.generateUrl());
    }
}
