package org.codelibs.taste.similarity;

import org.codelibs.taste.model.UserProfile;

import com.google.common.base.Preconditions;

/**
 * <p>
 * Expands a {@link UserProfile} into one {@link PairContribution} for every two distinct items of the user.
 * A user with k ratings yields k(k-1)/2 contributions; nothing is emitted for fewer than two ratings.
 * </p>
 *
 * <p>
 * The fan-out is quadratic in the number of ratings of a single user and heavy users are not capped.
 * </p>
 */
public final class PairExpander {

    private PairExpander() {
    }

    /**
     * @return number of contributions handed to the handler
     */
    public static long expand(final UserProfile profile,
            final PairContributionHandler handler) {
        Preconditions.checkArgument(profile != null, "profile is null");
        Preconditions.checkArgument(handler != null, "handler is null");
        final int length = profile.length();
        long count = 0;
        // item IDs of a profile are sorted, so i < j gives itemA < itemB
        for (int i = 0; i < length - 1; i++) {
            final int itemA = profile.getItemID(i);
            final int valueA = profile.getValue(i);
            for (int j = i + 1; j < length; j++) {
                handler.handle(new PairContribution(itemA, profile
                        .getItemID(j), valueA, profile.getValue(j)));
                count++;
            }
        }
        return count;
    }

    public static long numberOfPairs(final int numOfItems) {
        Preconditions.checkArgument(numOfItems >= 0,
                "numOfItems must be at least 0");
        return (long) numOfItems * (numOfItems - 1) / 2;
    }

}
