package com.bbthechange.tripplanner.config;

import com.bbthechange.tripplanner.model.EmailVerification;
import com.bbthechange.tripplanner.model.Trip;
import com.bbthechange.tripplanner.model.TripMembership;
import com.bbthechange.tripplanner.model.TripToken;
import com.bbthechange.tripplanner.model.User;
import com.bbthechange.tripplanner.repository.impl.EmailVerificationRepositoryImpl;
import com.bbthechange.tripplanner.repository.impl.TripMembershipRepositoryImpl;
import com.bbthechange.tripplanner.repository.impl.TripRepositoryImpl;
import com.bbthechange.tripplanner.repository.impl.TripTokenRepositoryImpl;
import com.bbthechange.tripplanner.repository.impl.UserRepositoryImpl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.CreateTableEnhancedRequest;
import software.amazon.awssdk.enhanced.dynamodb.model.EnhancedGlobalSecondaryIndex;
import software.amazon.awssdk.services.dynamodb.model.ProvisionedThroughput;
import software.amazon.awssdk.services.dynamodb.model.Projection;
import software.amazon.awssdk.services.dynamodb.model.ProjectionType;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;

import java.util.List;

/**
 * Creates the tables and their indexes on startup, for DynamoDB Local and fresh environments.
 */
@Component
@ConditionalOnProperty(name = "aws.dynamodb.create-tables", havingValue = "true")
public class DynamoDBTableInitializer implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(DynamoDBTableInitializer.class);

    @Autowired
    private DynamoDbEnhancedClient dynamoDbEnhancedClient;

    @Override
    public void run(ApplicationArguments args) {
        createTableIfNotExists(TripRepositoryImpl.TABLE_NAME, Trip.class, List.of(TripRepositoryImpl.OWNER_INDEX));
        createTableIfNotExists(TripTokenRepositoryImpl.TABLE_NAME, TripToken.class,
            List.of(TripTokenRepositoryImpl.TARGET_EMAIL_INDEX));
        createTableIfNotExists(TripMembershipRepositoryImpl.TABLE_NAME, TripMembership.class, List.of());
        createTableIfNotExists(UserRepositoryImpl.TABLE_NAME, User.class, List.of(UserRepositoryImpl.EMAIL_INDEX));
        createTableIfNotExists(EmailVerificationRepositoryImpl.TABLE_NAME, EmailVerification.class,
            List.of(EmailVerificationRepositoryImpl.TOKEN_INDEX));
    }

    private <T> void createTableIfNotExists(String tableName, Class<T> entityClass, List<String> indexNames) {
        DynamoDbTable<T> table = dynamoDbEnhancedClient.table(tableName, TableSchema.fromBean(entityClass));
        try {
            table.describeTable();
            logger.info("Table {} already exists", tableName);
        } catch (ResourceNotFoundException e) {
            logger.info("Creating table: {}", tableName);
            CreateTableEnhancedRequest.Builder request = CreateTableEnhancedRequest.builder()
                .provisionedThroughput(throughput());
            if (!indexNames.isEmpty()) {
                request.globalSecondaryIndices(indexNames.stream().map(this::createGSI).toList());
            }
            table.createTable(request.build());
            logger.info("Table {} created with indexes {}", tableName, indexNames);
        }
    }

    private EnhancedGlobalSecondaryIndex createGSI(String indexName) {
        return EnhancedGlobalSecondaryIndex.builder()
            .indexName(indexName)
            .provisionedThroughput(throughput())
            .projection(Projection.builder()
                .projectionType(ProjectionType.ALL)
                .build())
            .build();
    }

    private static ProvisionedThroughput throughput() {
        return ProvisionedThroughput.builder()
            .readCapacityUnits(5L)
            .writeCapacityUnits(5L)
            .build();
    }
}
