package com.bbthechange.tripplanner.repository.impl;

import com.bbthechange.tripplanner.exception.RepositoryException;
import com.bbthechange.tripplanner.model.EmailVerification;
import com.bbthechange.tripplanner.repository.EmailVerificationRepository;
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
public class EmailVerificationRepositoryImpl implements EmailVerificationRepository {

    private static final Logger logger = LoggerFactory.getLogger(EmailVerificationRepositoryImpl.class);
    public static final String TABLE_NAME = "EmailVerifications";
    public static final String TOKEN_INDEX = "VerificationTokenIndex";

    private final DynamoDbTable<EmailVerification> verificationTable;
    private final DynamoDbIndex<EmailVerification> tokenIndex;
    private final QueryPerformanceTracker queryTracker;

    @Autowired
    public EmailVerificationRepositoryImpl(DynamoDbEnhancedClient dynamoDbEnhancedClient, QueryPerformanceTracker queryTracker) {
        this.verificationTable = dynamoDbEnhancedClient.table(TABLE_NAME, TableSchema.fromBean(EmailVerification.class));
        this.tokenIndex = verificationTable.index(TOKEN_INDEX);
        this.queryTracker = queryTracker;
    }

    @Override
    public EmailVerification save(EmailVerification verification) {
        return queryTracker.trackQuery("PutItem", TABLE_NAME, () -> {
            try {
                verificationTable.putItem(verification);
                return verification;
            } catch (DynamoDbException e) {
                logger.error("Failed to save email verification for {}", verification.getEmail(), e);
                throw new RepositoryException("Failed to save email verification", e);
            }
        });
    }

    @Override
    public Optional<EmailVerification> findByEmail(String email) {
        return queryTracker.trackQuery("GetItem", TABLE_NAME, () -> {
            try {
                return Optional.ofNullable(verificationTable.getItem(Key.builder().partitionValue(email).build()));
            } catch (DynamoDbException e) {
                logger.error("Failed to load email verification for {}", email, e);
                throw new RepositoryException("Failed to load email verification", e);
            }
        });
    }

    @Override
    public Optional<EmailVerification> findByToken(String token) {
        return queryTracker.trackQuery("Query", TABLE_NAME, () -> {
            try {
                return tokenIndex.query(QueryConditional.keyEqualTo(Key.builder()
                        .partitionValue(token)
                        .build()))
                    .stream()
                    .flatMap(page -> page.items().stream())
                    .findFirst();
            } catch (DynamoDbException e) {
                logger.error("Failed to look up email verification token", e);
                throw new RepositoryException("Failed to look up verification token", e);
            }
        });
    }
}
