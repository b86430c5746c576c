package com.layeredcraft.cdk.constructs;

import static com.layeredcraft.cdk.utils.Kind.infof;

import com.layeredcraft.cdk.utils.KindCdk;
import com.layeredcraft.cdk.utils.ResourceNameUtils;
import org.jetbrains.annotations.NotNull;
import software.amazon.awscdk.services.dynamodb.GlobalSecondaryIndexProps;
import software.amazon.awscdk.services.dynamodb.Table;
import software.amazon.awscdk.services.lambda.EventSourceMapping;
import software.amazon.awscdk.services.lambda.IFunction;
import software.amazon.awscdk.services.lambda.StartingPosition;
import software.constructs.Construct;

/**
 * A DynamoDB table whose ARN, name, stream ARN (when streams are enabled) and GSI names are exported
 * from the stack as {stack}-{id}-arn, -name, -stream-arn and -gsi-{n}.
 */
public class DynamoDbTableConstruct extends Construct {

    public final Table table;
    public final String tableArn;
    public final String tableName;

    /** Null unless the table was created with a stream. */
    public final String tableStreamArn;

    public DynamoDbTableConstruct(
            @NotNull final Construct scope, @NotNull final String id, @NotNull DynamoDbTableConstructProps props) {
        super(scope, id);
        if (props.tableName().isBlank()) {
            throw new IllegalArgumentException("tableName is required");
        }

        var tableBuilder = Table.Builder.create(this, id)
                .tableName(props.tableName())
                .partitionKey(props.partitionKey())
                .removalPolicy(props.removalPolicy())
                .billingMode(props.billingMode());
        props.sortKey().ifPresent(tableBuilder::sortKey);
        props.stream().ifPresent(tableBuilder::stream);
        props.timeToLiveAttribute()
                .filter(attribute -> !attribute.isBlank())
                .ifPresent(tableBuilder::timeToLiveAttribute);
        this.table = tableBuilder.build();
        infof(
                "Created DynamoDB table %s (billing %s, stream %s)",
                props.tableName(), props.billingMode(), props.stream().map(Enum::name).orElse("none"));

        for (int i = 0; i < props.globalSecondaryIndexes().size(); i++) {
            GlobalSecondaryIndexProps index = props.globalSecondaryIndexes().get(i);
            this.table.addGlobalSecondaryIndex(index);
            KindCdk.exportedOutput(this, id, "gsi-" + i, index.getIndexName());
        }

        this.tableArn = this.table.getTableArn();
        this.tableName = props.tableName();
        this.tableStreamArn = this.table.getTableStreamArn();

        KindCdk.exportedOutput(this, id, "arn", this.tableArn);
        KindCdk.exportedOutput(this, id, "name", this.tableName);
        if (this.tableStreamArn != null) {
            KindCdk.exportedOutput(this, id, "stream-arn", this.tableStreamArn);
        }
    }

    /**
     * Processes the table stream with the given function, one record at a time from the oldest record.
     *
     * @throws IllegalStateException when the table has no stream
     */
    public EventSourceMapping attachStreamLambda(@NotNull IFunction lambda) {
        if (this.tableStreamArn == null) {
            throw new IllegalStateException("Cannot attach stream Lambda to table without streams enabled");
        }

        var mapping = EventSourceMapping.Builder.create(this, ResourceNameUtils.buildStreamMappingId(this.tableName))
                .target(lambda)
                .eventSourceArn(this.tableStreamArn)
                .startingPosition(StartingPosition.TRIM_HORIZON)
                .batchSize(1)
                .build();
        infof("Attached stream of table %s to %s", this.tableName, lambda.getNode().getId());
        return mapping;
    }
}
