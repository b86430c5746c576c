package com.layeredcraft.cdk.utils;

import static com.layeredcraft.cdk.utils.Kind.infof;
import static com.layeredcraft.cdk.utils.Kind.warnf;

import software.amazon.awscdk.CfnOutput;
import software.amazon.awscdk.Stack;
import software.amazon.awssdk.utils.StringUtils;
import software.constructs.Construct;

public class KindCdk {

    /** CloudFormation's own limit, one below {@link ExportNameGenerator#MAX_EXPORT_NAME_LENGTH}. */
    public static final int CLOUDFORMATION_EXPORT_NAME_LIMIT = 255;

    /**
     * Creates a CfnOutput with id {@code {resourceId}-{qualifier}} exported under
     * {@link ExportNameGenerator#forStack} of the enclosing stack.
     */
    public static CfnOutput exportedOutput(Construct scope, String resourceId, String qualifier, String value) {
        if (StringUtils.isBlank(value)) {
            warnf("CfnOutput value for %s-%s is blank", resourceId, qualifier);
        }
        var exportName = ExportNameGenerator.forStack(Stack.of(scope), resourceId, qualifier);
        if (exportName.length() > CLOUDFORMATION_EXPORT_NAME_LIMIT) {
            warnf(
                    "Export name for %s-%s is %d characters; synthesis rejects names over %d",
                    resourceId, qualifier, exportName.length(), CLOUDFORMATION_EXPORT_NAME_LIMIT);
        }
        var output = CfnOutput.Builder.create(scope, resourceId + "-" + qualifier)
                .exportName(exportName)
                .value(value)
                .build();
        infof("Exported output %s as %s", output.getNode().getId(), exportName);
        return output;
    }
}
