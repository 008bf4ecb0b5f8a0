package org.codelibs.taste.model;

import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

import org.codelibs.taste.common.FastIDSet;
import org.codelibs.taste.exception.MalformedRatingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.AbstractIterator;
import com.google.common.collect.Iterators;
import com.google.common.collect.PeekingIterator;

/**
 * <p>
 * Groups ratings by user into {@link UserProfile}s. When a user rated the same item more than once, the
 * rating read last wins.
 * </p>
 *
 * <p>
 * In {@link GroupingMode#FULL} mode every rating is buffered before the first profile is returned, so the
 * input may come in any order. In {@link GroupingMode#CONTIGUOUS} mode a profile is returned as soon as the
 * next user's ratings start, keeping a single user in memory; a user whose ratings are split across the
 * input is rejected.
 * </p>
 */
public class UserGrouper {

    private static final Logger log = LoggerFactory
            .getLogger(UserGrouper.class);

    private final GroupingMode mode;

    public UserGrouper() {
        this(GroupingMode.FULL);
    }

    public UserGrouper(final GroupingMode mode) {
        Preconditions.checkArgument(mode != null, "mode is null");
        this.mode = mode;
    }

    public GroupingMode getMode() {
        return mode;
    }

    public Iterator<UserProfile> group(final Iterator<Rating> ratings) {
        Preconditions.checkArgument(ratings != null, "ratings is null");
        if (mode == GroupingMode.CONTIGUOUS) {
            return new ContiguousIterator(Iterators.peekingIterator(ratings));
        }
        return new FullIterator(ratings);
    }

    private static final class FullIterator extends
            AbstractIterator<UserProfile> {

        private final Iterator<Rating> ratings;

        private Iterator<Map.Entry<Integer, Map<Integer, Integer>>> users;

        private int count = 0;

        FullIterator(final Iterator<Rating> ratings) {
            this.ratings = ratings;
        }

        @Override
        protected UserProfile computeNext() {
            if (users == null) {
                users = collect().entrySet().iterator();
            }
            if (!users.hasNext()) {
                log.info("Grouped {} users", count);
                return endOfData();
            }
            final Map.Entry<Integer, Map<Integer, Integer>> entry = users
                    .next();
            // release the buffered ratings once the profile owns them
            users.remove();
            count++;
            return new UserProfile(entry.getKey(), entry.getValue());
        }

        private Map<Integer, Map<Integer, Integer>> collect() {
            final Map<Integer, Map<Integer, Integer>> ratingsByUser = new LinkedHashMap<Integer, Map<Integer, Integer>>();
            long numOfRatings = 0;
            while (ratings.hasNext()) {
                final Rating rating = ratings.next();
                Map<Integer, Integer> userRatings = ratingsByUser.get(rating
                        .getUserID());
                if (userRatings == null) {
                    userRatings = new HashMap<Integer, Integer>();
                    ratingsByUser.put(rating.getUserID(), userRatings);
                }
                userRatings.put(rating.getItemID(), rating.getValue());
                if (++numOfRatings % 100000 == 0) {
                    log.info("Read {} ratings", numOfRatings);
                }
            }
            log.info("Read {} ratings from {} users", numOfRatings,
                    ratingsByUser.size());
            return ratingsByUser;
        }
    }

    private static final class ContiguousIterator extends
            AbstractIterator<UserProfile> {

        private final PeekingIterator<Rating> ratings;

        private final FastIDSet finishedUserIDs = new FastIDSet();

        ContiguousIterator(final PeekingIterator<Rating> ratings) {
            this.ratings = ratings;
        }

        @Override
        protected UserProfile computeNext() {
            if (!ratings.hasNext()) {
                log.info("Grouped {} users", finishedUserIDs.size());
                return endOfData();
            }
            final int userID = ratings.peek().getUserID();
            if (finishedUserIDs.contains(userID)) {
                throw new MalformedRatingException("Ratings of user " + userID
                        + " are not contiguous.");
            }
            final Map<Integer, Integer> userRatings = new HashMap<Integer, Integer>();
            while (ratings.hasNext() && ratings.peek().getUserID() == userID) {
                final Rating rating = ratings.next();
                userRatings.put(rating.getItemID(), rating.getValue());
            }
            finishedUserIDs.add(userID);
            if (finishedUserIDs.size() % 10000 == 0) {
                log.info("Grouped {} users", finishedUserIDs.size());
            }
            return new UserProfile(userID, userRatings);
        }
    }

}
