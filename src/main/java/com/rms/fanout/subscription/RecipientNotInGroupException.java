package com.rms.fanout.subscription;

/**
 * A group-scoped subscription named a recipient that has no stored events under that group.
 */
public class RecipientNotInGroupException extends RuntimeException {

    private final String groupId;
    private final String recipientId;

    public RecipientNotInGroupException(String groupId, String recipientId) {
        super("Recipient " + recipientId + " does not belong to group " + groupId);
        this.groupId = groupId;
        this.recipientId = recipientId;
    }

    public String getGroupId() {
        return groupId;
    }

    public String getRecipientId() {
        return recipientId;
    }
}
