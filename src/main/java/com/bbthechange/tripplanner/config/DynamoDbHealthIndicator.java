package com.bbthechange.tripplanner.config;

import com.bbthechange.tripplanner.repository.impl.TripRepositoryImpl;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableRequest;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.TableStatus;

/**
 * Reports DOWN unless the Trips table is reachable and ACTIVE.
 */
@Component
public class DynamoDbHealthIndicator implements HealthIndicator {

    private final DynamoDbClient dynamoDbClient;

    @Autowired
    public DynamoDbHealthIndicator(DynamoDbClient dynamoDbClient) {
        this.dynamoDbClient = dynamoDbClient;
    }

    @Override
    public Health health() {
        try {
            TableStatus status = dynamoDbClient.describeTable(DescribeTableRequest.builder()
                    .tableName(TripRepositoryImpl.TABLE_NAME)
                    .build())
                .table()
                .tableStatus();

            if (status == TableStatus.ACTIVE) {
                return Health.up().withDetail("tripsTable", "ACTIVE").build();
            }
            return Health.down()
                .withDetail("tripsTable", String.valueOf(status))
                .build();
        } catch (DynamoDbException e) {
            return Health.down()
                .withDetail("error", "DynamoDB connection failed")
                .withDetail("message", e.getMessage())
                .build();
        }
    }
}
