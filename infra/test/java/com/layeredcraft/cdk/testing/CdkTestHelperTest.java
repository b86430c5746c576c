package com.layeredcraft.cdk.testing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Paths;
import org.junit.jupiter.api.Test;
import software.amazon.awscdk.Stack;
import software.amazon.awscdk.StackProps;
import software.constructs.Construct;

class CdkTestHelperTest {

    public static class SampleStack extends Stack {
        public SampleStack(Construct scope, String id, StackProps props) {
            super(scope, id, props);
        }
    }

    public static class NoPropsStack extends Stack {
        public NoPropsStack(Construct scope, String id) {
            super(scope, id);
        }
    }

    public static class FailingStack extends Stack {
        public FailingStack(Construct scope, String id, StackProps props) {
            super(scope, id, props);
            throw new IllegalStateException("boom");
        }
    }

    @Test
    void defaultStackUsesTestEnvironment() {
        var testStack = CdkTestHelper.createTestStack();

        assertEquals(CdkTestHelper.DEFAULT_STACK_NAME, testStack.stack().getStackName());
        assertEquals(CdkTestHelper.DEFAULT_REGION, testStack.stack().getRegion());
        assertEquals(CdkTestHelper.DEFAULT_ACCOUNT, testStack.stack().getAccount());
        assertEquals(1, testStack.app().getNode().getChildren().size());
    }

    @Test
    void namedStackInCustomEnvironment() {
        Stack stack = CdkTestHelper.createTestStackMinimal("orders-stack", "eu-west-2", "111111111111");

        assertEquals("orders-stack", stack.getStackName());
        assertEquals("eu-west-2", stack.getRegion());
        assertEquals("111111111111", stack.getAccount());
    }

    @Test
    void createsCustomStackTypes() {
        var stack = CdkTestHelper.createTestStackMinimal(SampleStack.class, "sample", StackProps.builder().build());

        assertInstanceOf(SampleStack.class, stack);
        assertEquals("sample", stack.getStackName());
    }

    @Test
    void customStackTypeNeedsPropsConstructor() {
        var error = assertThrows(
                IllegalArgumentException.class,
                () -> CdkTestHelper.createTestStack(NoPropsStack.class, "sample", StackProps.builder().build()));
        assertTrue(error.getMessage().contains("(Construct, String, StackProps)"));
    }

    @Test
    void constructorFailuresAreReported() {
        var error = assertThrows(
                IllegalArgumentException.class,
                () -> CdkTestHelper.createTestStack(FailingStack.class, "sample", StackProps.builder().build()));
        assertInstanceOf(IllegalStateException.class, error.getCause());
    }

    @Test
    void resolvesTestAssetsFromClasspath() {
        assertTrue(Files.isRegularFile(Paths.get(CdkTestHelper.getTestLambdaAssetPath(), "bootstrap")));
        assertTrue(Files.isRegularFile(Paths.get(CdkTestHelper.getTestStaticSiteAssetPath(), "index.html")));
        assertThrows(IllegalStateException.class, () -> CdkTestHelper.getTestAssetPath("test-assets/missing"));
    }

    @Test
    void propsBuilderCarriesTestDefaults() {
        var props = CdkTestHelper.createPropsBuilder().build();

        assertEquals("test-function", props.functionName());
        assertEquals("test", props.functionSuffix());
        assertEquals("test-function-role", props.roleName());
        assertEquals("test-function-policy", props.policyName());
        assertEquals("test", props.environmentVariables().get("ENVIRONMENT"));
        assertTrue(props.includeOtelLayer());
        assertEquals(CdkTestHelper.getTestLambdaAssetPath(), props.assetPath());
    }
}
