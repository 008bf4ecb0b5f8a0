package org.codelibs.taste.model;

import java.util.Arrays;
import java.util.Map;

import com.google.common.base.Preconditions;
import com.google.common.primitives.Ints;

/**
 * <p>
 * All ratings of one user, held as two parallel arrays of item IDs and values sorted by item ID. Each item
 * appears at most once.
 * </p>
 *
 * <p>
 * A profile lives only until its item pairs have been expanded; it is never retained by the aggregation.
 * </p>
 */
public final class UserProfile {

    private final int userID;

    private final int[] itemIDs;

    private final int[] values;

    /**
     * @param userID user owning the ratings
     * @param ratings item ID to rating value
     */
    public UserProfile(final int userID, final Map<Integer, Integer> ratings) {
        Preconditions.checkArgument(ratings != null, "ratings is null");
        this.userID = userID;
        itemIDs = Ints.toArray(ratings.keySet());
        Arrays.sort(itemIDs);
        values = new int[itemIDs.length];
        for (int i = 0; i < itemIDs.length; i++) {
            values[i] = ratings.get(itemIDs[i]);
        }
    }

    public int getUserID() {
        return userID;
    }

    public int length() {
        return itemIDs.length;
    }

    public int getItemID(final int i) {
        return itemIDs[i];
    }

    public int getValue(final int i) {
        return values[i];
    }

    public boolean hasItem(final int itemID) {
        return Arrays.binarySearch(itemIDs, itemID) >= 0;
    }

    @Override
    public String toString() {
        if (itemIDs.length == 0) {
            return "UserProfile[user:" + userID + ", {}]";
        }
        final StringBuilder result = new StringBuilder(20 * itemIDs.length);
        result.append("UserProfile[user:");
        result.append(userID);
        result.append(", {");
        for (int i = 0; i < itemIDs.length; i++) {
            if (i > 0) {
                result.append(',');
            }
            result.append(itemIDs[i]);
            result.append('=');
            result.append(values[i]);
        }
        result.append("}]");
        return result.toString();
    }

}
