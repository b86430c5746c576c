package com.layeredcraft.cdk.constructs;

import static com.layeredcraft.cdk.utils.Kind.debugf;
import static com.layeredcraft.cdk.utils.Kind.infof;

import com.layeredcraft.cdk.utils.KindCdk;
import com.layeredcraft.cdk.utils.ResourceNameUtils;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.NotNull;
import software.amazon.awscdk.Duration;
import software.amazon.awscdk.Fn;
import software.amazon.awscdk.RemovalPolicy;
import software.amazon.awscdk.Stack;
import software.amazon.awscdk.services.iam.Effect;
import software.amazon.awscdk.services.iam.Policy;
import software.amazon.awscdk.services.iam.PolicyStatement;
import software.amazon.awscdk.services.iam.Role;
import software.amazon.awscdk.services.iam.ServicePrincipal;
import software.amazon.awscdk.services.lambda.Alias;
import software.amazon.awscdk.services.lambda.CfnFunction;
import software.amazon.awscdk.services.lambda.Code;
import software.amazon.awscdk.services.lambda.Function;
import software.amazon.awscdk.services.lambda.FunctionUrl;
import software.amazon.awscdk.services.lambda.FunctionUrlAuthType;
import software.amazon.awscdk.services.lambda.FunctionUrlOptions;
import software.amazon.awscdk.services.lambda.IVersion;
import software.amazon.awscdk.services.lambda.LayerVersion;
import software.amazon.awscdk.services.lambda.Permission;
import software.amazon.awscdk.services.lambda.Runtime;
import software.amazon.awscdk.services.lambda.Tracing;
import software.amazon.awscdk.services.lambda.VersionOptions;
import software.amazon.awscdk.services.logs.LogGroup;
import software.amazon.awscdk.services.logs.RetentionDays;
import software.constructs.Construct;

/**
 * A custom-runtime (provided.al2023) Lambda function with its own role, inline logging policy,
 * two week log group and a "live" alias on the current version.
 *
 * Resources created under the construct id {@code id}:
 * - {id}-policy / {id}-role: inline policy scoped to the function's log group, plus caller statements
 * - {id}-log-group: /aws/lambda/{functionName}-{functionSuffix}
 * - {id}-function, its current version (retained on replacement) and {id}-alias ("live")
 * - one permission per target (function, version, alias) for each configured {@link LambdaPermission}
 * - optionally a function URL on the alias, exported as {stack}-{id}-url-output
 */
public class LambdaFunctionConstruct extends Construct {

    public static final String LIVE_ALIAS_NAME = "live";

    public final Function lambdaFunction;
    public final Alias liveAlias;
    public final Role role;
    public final LogGroup logGroup;

    /** Domain of the live alias function URL, or null when no URL was generated. */
    public final String liveAliasFunctionUrlDomain;

    public LambdaFunctionConstruct(
            @NotNull final Construct scope, @NotNull final String id, @NotNull LambdaFunctionConstructProps props) {
        super(scope, id);
        validate(props);

        var stack = Stack.of(this);
        var region = stack.getRegion();
        var account = stack.getAccount();
        var fullFunctionName = ResourceNameUtils.buildFunctionName(props.functionName(), props.functionSuffix());

        var policy = Policy.Builder.create(this, id + "-policy")
                .policyName(props.policyName())
                .statements(List.of(
                        PolicyStatement.Builder.create()
                                .actions(List.of("logs:CreateLogStream", "logs:CreateLogGroup", "logs:TagResource"))
                                .resources(List.of(ResourceNameUtils.buildLambdaLogGroupArnPattern(
                                        region, account, fullFunctionName, false)))
                                .effect(Effect.ALLOW)
                                .build(),
                        PolicyStatement.Builder.create()
                                .actions(List.of("logs:PutLogEvents"))
                                .resources(List.of(ResourceNameUtils.buildLambdaLogGroupArnPattern(
                                        region, account, fullFunctionName, true)))
                                .effect(Effect.ALLOW)
                                .build()))
                .build();
        if (!props.policyStatements().isEmpty()) {
            policy.addStatements(props.policyStatements().toArray(new PolicyStatement[0]));
        }

        this.role = Role.Builder.create(this, id + "-role")
                .assumedBy(new ServicePrincipal("lambda.amazonaws.com"))
                .roleName(props.roleName())
                .build();
        this.role.attachInlinePolicy(policy);
        infof(
                "Created role %s with inline policy %s (%d additional statements)",
                props.roleName(), props.policyName(), props.policyStatements().size());

        this.logGroup = LogGroup.Builder.create(this, id + "-log-group")
                .logGroupName(ResourceNameUtils.buildLambdaLogGroupName(fullFunctionName))
                .retention(RetentionDays.TWO_WEEKS)
                .removalPolicy(RemovalPolicy.DESTROY)
                .build();

        this.lambdaFunction = Function.Builder.create(this, id + "-function")
                .functionName(fullFunctionName)
                .runtime(Runtime.PROVIDED_AL2023)
                .handler("bootstrap")
                .code(Code.fromAsset(props.assetPath()))
                .role(this.role)
                .memorySize(props.memorySize())
                .timeout(Duration.seconds(props.timeoutInSeconds()))
                .architecture(props.architecture())
                .environment(props.environmentVariables())
                .logGroup(this.logGroup)
                .tracing(props.includeOtelLayer() ? Tracing.ACTIVE : Tracing.DISABLED)
                .currentVersionOptions(VersionOptions.builder()
                        .removalPolicy(RemovalPolicy.RETAIN)
                        .build())
                .build();
        infof(
                "Created Lambda %s (%d MB, %ds timeout) from asset %s",
                fullFunctionName, props.memorySize(), props.timeoutInSeconds(), props.assetPath());

        if (props.includeOtelLayer()) {
            var layerArn =
                    ResourceNameUtils.buildOtelLayerArn(region, props.architecture(), props.otelLayerVersion());
            this.lambdaFunction.addLayers(LayerVersion.fromLayerVersionArn(this, "OTELLambdaLayer", layerArn));
            debugf("Added OTEL collector layer %s to %s", layerArn, fullFunctionName);
        }

        if (props.enableSnapStart()) {
            var cfnFunction = (CfnFunction) this.lambdaFunction.getNode().getDefaultChild();
            cfnFunction.addPropertyOverride("SnapStart", Map.of("ApplyOn", "PublishedVersions"));
            infof("Enabled SnapStart on published versions of %s", fullFunctionName);
        }

        // A new version is published whenever the function configuration or code changes
        var currentVersion = this.lambdaFunction.getCurrentVersion();
        this.liveAlias = Alias.Builder.create(this, id + "-alias")
                .aliasName(LIVE_ALIAS_NAME)
                .version(currentVersion)
                .build();

        addPermissionsToAllTargets(id + "-permission", currentVersion, props.permissions());

        if (props.generateUrl()) {
            FunctionUrl functionUrl = this.liveAlias.addFunctionUrl(FunctionUrlOptions.builder()
                    .authType(FunctionUrlAuthType.NONE)
                    .build());
            // https://<domain>/ -> <domain>
            this.liveAliasFunctionUrlDomain = Fn.select(2, Fn.split("/", functionUrl.getUrl()));
            KindCdk.exportedOutput(this, id, "url-output", functionUrl.getUrl());
        } else {
            this.liveAliasFunctionUrlDomain = null;
        }
    }

    private void addPermissionsToAllTargets(String baseId, IVersion version, List<LambdaPermission> permissions) {
        for (int i = 0; i < permissions.size(); i++) {
            var perm = permissions.get(i);
            var permission = Permission.builder()
                    .principal(new ServicePrincipal(perm.principal()))
                    .action(perm.action())
                    .eventSourceToken(perm.eventSourceToken().orElse(null))
                    .sourceArn(perm.sourceArn().orElse(null))
                    .build();

            this.lambdaFunction.addPermission(ResourceNameUtils.buildIndexedId(baseId, "fn", i), permission);
            version.addPermission(ResourceNameUtils.buildIndexedId(baseId, "ver", i), permission);
            this.liveAlias.addPermission(ResourceNameUtils.buildIndexedId(baseId, "alias", i), permission);
            infof("Granted %s to %s on function, version and alias", perm.action(), perm.principal());
        }
    }

    private static void validate(LambdaFunctionConstructProps props) {
        requireNonBlank(props.functionName(), "functionName");
        requireNonBlank(props.functionSuffix(), "functionSuffix");
        requireNonBlank(props.assetPath(), "assetPath");
        requireNonBlank(props.roleName(), "roleName");
        requireNonBlank(props.policyName(), "policyName");
    }

    private static void requireNonBlank(String value, String name) {
        if (value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
    }
}
