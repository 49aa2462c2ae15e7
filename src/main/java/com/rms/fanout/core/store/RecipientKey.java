package com.rms.fanout.core.store;

import com.rms.fanout.core.model.DomainEvent;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Identity under which a recipient's recent events are stored.
 *
 * <p>A recipient is either standalone or scoped to a group. Both forms map to distinct store keys:</p>
 * <pre>
 * &lt;prefix&gt;:&lt;recipient&gt;
 * &lt;prefix&gt;:group:&lt;group&gt;:&lt;recipient&gt;
 * </pre>
 *
 * @param groupId     owning group, {@code null} when not group-scoped
 * @param recipientId recipient (wallet) identifier
 */
public record RecipientKey(String groupId, String recipientId) {

    /** Ids become {@code :}-delimited key and notification segments, so they may not contain one. */
    public static final String ID_PATTERN = "^[^:\\s]+$";

    private static final Pattern ID = Pattern.compile(ID_PATTERN);

    private static final String GROUP_SEGMENT = "group";

    public RecipientKey {
        if (recipientId == null || recipientId.isBlank()) {
            throw new IllegalArgumentException("recipientId is required");
        }
        if (groupId != null && groupId.isBlank()) {
            groupId = null;
        }
    }

    public static RecipientKey of(String recipientId) {
        return new RecipientKey(null, recipientId);
    }

    public static RecipientKey of(DomainEvent event) {
        return new RecipientKey(event.groupId(), event.recipientId());
    }

    public static boolean isValidId(String id) {
        return id != null && ID.matcher(id).matches();
    }

    public boolean hasGroup() {
        return groupId != null;
    }

    public String toStoreKey(String prefix) {
        return hasGroup()
                ? prefix + ":" + GROUP_SEGMENT + ":" + groupId + ":" + recipientId
                : prefix + ":" + recipientId;
    }

    /**
     * Reverses {@link #toStoreKey(String)}.
     *
     * @return empty when the key does not belong to {@code prefix} or has an unexpected shape
     */
    public static Optional<RecipientKey> fromStoreKey(String prefix, String storeKey) {
        if (storeKey == null || !storeKey.startsWith(prefix + ":")) {
            return Optional.empty();
        }
        String[] parts = storeKey.substring(prefix.length() + 1).split(":", -1);
        if (parts.length == 1 && !parts[0].isBlank()) {
            return Optional.of(of(parts[0]));
        }
        if (parts.length == 3 && GROUP_SEGMENT.equals(parts[0]) && !parts[1].isBlank() && !parts[2].isBlank()) {
            return Optional.of(new RecipientKey(parts[1], parts[2]));
        }
        return Optional.empty();
    }
}
