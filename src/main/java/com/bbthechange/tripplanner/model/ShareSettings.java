package com.bbthechange.tripplanner.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;

@Data
@NoArgsConstructor
@AllArgsConstructor
@DynamoDbBean
public class ShareSettings {
    private Boolean isPublic;
    private Boolean allowComments;
    private Boolean passwordProtected;
    private String passwordHash;    // BCrypt, never plaintext

    public boolean requiresPassword() {
        return Boolean.TRUE.equals(passwordProtected);
    }
}
