package com.layeredcraft.cdk.constructs;

import java.util.List;
import java.util.Optional;
import org.immutables.value.Value;
import software.amazon.awscdk.RemovalPolicy;
import software.amazon.awscdk.services.dynamodb.Attribute;
import software.amazon.awscdk.services.dynamodb.BillingMode;
import software.amazon.awscdk.services.dynamodb.GlobalSecondaryIndexProps;
import software.amazon.awscdk.services.dynamodb.StreamViewType;

@Value.Immutable
public interface DynamoDbTableConstructProps {

    String tableName();

    Attribute partitionKey();

    Optional<Attribute> sortKey();

    RemovalPolicy removalPolicy();

    /** PAY_PER_REQUEST or PROVISIONED */
    BillingMode billingMode();

    List<GlobalSecondaryIndexProps> globalSecondaryIndexes();

    /** Enables the table stream with this view type */
    Optional<StreamViewType> stream();

    Optional<String> timeToLiveAttribute();

    static ImmutableDynamoDbTableConstructProps.Builder builder() {
        return ImmutableDynamoDbTableConstructProps.builder();
    }
}
