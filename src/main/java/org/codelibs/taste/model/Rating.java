package org.codelibs.taste.model;

import java.io.Serializable;

/**
 * A single rating of an item by a user.
 */
public final class Rating implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int userID;

    private final int itemID;

    private final int value;

    public Rating(final int userID, final int itemID, final int value) {
        this.userID = userID;
        this.itemID = itemID;
        this.value = value;
    }

    public int getUserID() {
        return userID;
    }

    public int getItemID() {
        return itemID;
    }

    public int getValue() {
        return value;
    }

    @Override
    public int hashCode() {
        return (userID * 31 + itemID) * 31 + value;
    }

    @Override
    public boolean equals(final Object o) {
        if (!(o instanceof Rating)) {
            return false;
        }
        final Rating other = (Rating) o;
        return userID == other.userID && itemID == other.itemID
                && value == other.value;
    }

    @Override
    public String toString() {
        return "Rating[userID: " + userID + ", itemID:" + itemID + ", value:"
                + value + ']';
    }

}
