package com.bbthechange.tripplanner.repository.impl;

import com.bbthechange.tripplanner.exception.RepositoryException;
import com.bbthechange.tripplanner.model.User;
import com.bbthechange.tripplanner.repository.UserRepository;
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

import java.util.Optional;

@Repository
public class UserRepositoryImpl implements UserRepository {

    private static final Logger logger = LoggerFactory.getLogger(UserRepositoryImpl.class);
    public static final String TABLE_NAME = "Users";
    public static final String EMAIL_INDEX = "EmailIndex";

    private final DynamoDbTable<User> userTable;
    private final DynamoDbIndex<User> emailIndex;
    private final QueryPerformanceTracker queryTracker;

    @Autowired
    public UserRepositoryImpl(DynamoDbEnhancedClient dynamoDbEnhancedClient, QueryPerformanceTracker queryTracker) {
        this.userTable = dynamoDbEnhancedClient.table(TABLE_NAME, TableSchema.fromBean(User.class));
        this.emailIndex = userTable.index(EMAIL_INDEX);
        this.queryTracker = queryTracker;
    }

    @Override
    public User save(User user) {
        return queryTracker.trackQuery("PutItem", TABLE_NAME, () -> {
            try {
                userTable.putItem(user);
                return user;
            } catch (DynamoDbException e) {
                logger.error("Failed to save user {}", user.getId(), e);
                throw new RepositoryException("Failed to save user", e);
            }
        });
    }

    @Override
    public Optional<User> findById(String id) {
        return queryTracker.trackQuery("GetItem", TABLE_NAME, () -> {
            try {
                return Optional.ofNullable(userTable.getItem(Key.builder().partitionValue(id).build()));
            } catch (DynamoDbException e) {
                logger.error("Failed to load user {}", id, e);
                throw new RepositoryException("Failed to load user", e);
            }
        });
    }

    @Override
    public Optional<User> findByEmail(String email) {
        return queryTracker.trackQuery("Query", TABLE_NAME, () -> {
            try {
                return emailIndex.query(QueryConditional.keyEqualTo(Key.builder()
                        .partitionValue(email)
                        .build()))
                    .stream()
                    .flatMap(page -> page.items().stream())
                    .findFirst();
            } catch (DynamoDbException e) {
                logger.error("Failed to look up user by email", e);
                throw new RepositoryException("Failed to look up user", e);
            }
        });
    }
}
