package com.bbthechange.tripplanner.repository.impl;

import com.bbthechange.tripplanner.exception.RepositoryException;
import com.bbthechange.tripplanner.model.TripToken;
import com.bbthechange.tripplanner.repository.TripTokenRepository;
import com.bbthechange.tripplanner.util.QueryPerformanceTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbIndex;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryConditional;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

@Repository
public class TripTokenRepositoryImpl implements TripTokenRepository {

    private static final Logger logger = LoggerFactory.getLogger(TripTokenRepositoryImpl.class);
    public static final String TABLE_NAME = "TripTokens";
    public static final String TARGET_EMAIL_INDEX = "TargetEmailIndex";

    private final DynamoDbTable<TripToken> tokenTable;
    private final DynamoDbIndex<TripToken> targetEmailIndex;
    private final QueryPerformanceTracker queryTracker;

    @Autowired
    public TripTokenRepositoryImpl(DynamoDbEnhancedClient dynamoDbEnhancedClient, QueryPerformanceTracker queryTracker) {
        this.tokenTable = dynamoDbEnhancedClient.table(TABLE_NAME, TableSchema.fromBean(TripToken.class));
        this.targetEmailIndex = tokenTable.index(TARGET_EMAIL_INDEX);
        this.queryTracker = queryTracker;
    }

    @Override
    public Optional<TripToken> findByToken(String token) {
        return queryTracker.trackQuery("GetItem", TABLE_NAME, () -> {
            try {
                return Optional.ofNullable(tokenTable.getItem(Key.builder().partitionValue(token).build()));
            } catch (DynamoDbException e) {
                logger.error("Failed to look up trip token", e);
                throw new RepositoryException("Failed to look up token", e);
            }
        });
    }

    @Override
    public boolean exists(String token) {
        return findByToken(token).isPresent();
    }

    @Override
    public List<TripToken> findByTargetEmail(String email) {
        return queryTracker.trackQuery("Query", TABLE_NAME, () -> {
            try {
                return targetEmailIndex.query(QueryConditional.keyEqualTo(Key.builder()
                        .partitionValue(email)
                        .build()))
                    .stream()
                    .flatMap(page -> page.items().stream())
                    .collect(Collectors.toList());
            } catch (DynamoDbException e) {
                logger.error("Failed to query tokens for target email {}", email, e);
                throw new RepositoryException("Failed to query tokens by email", e);
            }
        });
    }

    @Override
    public void delete(String token) {
        queryTracker.trackQuery("DeleteItem", TABLE_NAME, () -> {
            try {
                tokenTable.deleteItem(Key.builder().partitionValue(token).build());
                return null;
            } catch (DynamoDbException e) {
                logger.error("Failed to delete trip token", e);
                throw new RepositoryException("Failed to delete token", e);
            }
        });
    }
}
