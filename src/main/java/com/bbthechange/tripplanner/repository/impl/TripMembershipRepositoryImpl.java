package com.bbthechange.tripplanner.repository.impl;

import com.bbthechange.tripplanner.exception.RepositoryException;
import com.bbthechange.tripplanner.model.TripMembership;
import com.bbthechange.tripplanner.repository.TripMembershipRepository;
import com.bbthechange.tripplanner.util.QueryPerformanceTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryConditional;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryEnhancedRequest;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;

import java.util.List;
import java.util.stream.Collectors;

@Repository
public class TripMembershipRepositoryImpl implements TripMembershipRepository {

    private static final Logger logger = LoggerFactory.getLogger(TripMembershipRepositoryImpl.class);
    public static final String TABLE_NAME = "TripMemberships";

    private final DynamoDbTable<TripMembership> membershipTable;
    private final QueryPerformanceTracker queryTracker;

    @Autowired
    public TripMembershipRepositoryImpl(DynamoDbEnhancedClient dynamoDbEnhancedClient, QueryPerformanceTracker queryTracker) {
        this.membershipTable = dynamoDbEnhancedClient.table(TABLE_NAME, TableSchema.fromBean(TripMembership.class));
        this.queryTracker = queryTracker;
    }

    @Override
    public List<TripMembership> findByUserId(String userId) {
        return queryTracker.trackQuery("Query", TABLE_NAME, () -> {
            try {
                return membershipTable.query(QueryEnhancedRequest.builder()
                        .queryConditional(QueryConditional.keyEqualTo(Key.builder()
                            .partitionValue(userId)
                            .build()))
                        .build())
                    .stream()
                    .flatMap(page -> page.items().stream())
                    .collect(Collectors.toList());
            } catch (DynamoDbException e) {
                logger.error("Failed to find trip memberships for user {}", userId, e);
                throw new RepositoryException("Failed to retrieve trip memberships", e);
            }
        });
    }

    @Override
    public void delete(String userId, String tripId) {
        queryTracker.trackQuery("DeleteItem", TABLE_NAME, () -> {
            try {
                membershipTable.deleteItem(Key.builder()
                    .partitionValue(userId)
                    .sortValue(tripId)
                    .build());
                return null;
            } catch (DynamoDbException e) {
                logger.error("Failed to delete membership of user {} in trip {}", userId, tripId, e);
                throw new RepositoryException("Failed to delete trip membership", e);
            }
        });
    }
}
