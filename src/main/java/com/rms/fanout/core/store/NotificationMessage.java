package com.rms.fanout.core.store;

/**
 * Payload published on the store's notification channel whenever an event is appended.
 *
 * <p>Carries no event data, only where to find it:</p>
 * <pre>
 * &lt;recipient&gt;:&lt;timestamp_ns&gt;
 * &lt;group&gt;:&lt;recipient&gt;:&lt;timestamp_ns&gt;
 * </pre>
 * Receivers re-read the recipient's events scored exactly {@code timestamp_ns}.
 */
public record NotificationMessage(RecipientKey key, long timestampNs) {

    public String format() {
        return key.hasGroup()
                ? key.groupId() + ":" + key.recipientId() + ":" + timestampNs
                : key.recipientId() + ":" + timestampNs;
    }

    /**
     * @throws IllegalArgumentException if the message does not have two or three non-empty parts
     *                                  ending in a numeric timestamp
     */
    public static NotificationMessage parse(String message) {
        if (message == null) {
            throw new IllegalArgumentException("Notification message is null");
        }
        String[] parts = message.split(":", -1);
        try {
            if (parts.length == 2) {
                return new NotificationMessage(RecipientKey.of(parts[0]), Long.parseLong(parts[1]));
            }
            if (parts.length == 3) {
                return new NotificationMessage(new RecipientKey(parts[0], parts[1]), Long.parseLong(parts[2]));
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid timestamp in notification: " + message, e);
        }
        throw new IllegalArgumentException("Unexpected notification format: " + message);
    }
}
