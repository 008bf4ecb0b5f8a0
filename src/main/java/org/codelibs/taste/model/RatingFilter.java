package org.codelibs.taste.model;

import java.util.Iterator;

import com.google.common.base.Preconditions;
import com.google.common.base.Predicate;
import com.google.common.collect.Iterators;

/**
 * Drops ratings below an inclusive minimum value.
 */
public class RatingFilter implements Predicate<Rating> {

    private final int minRating;

    public RatingFilter(final int minRating) {
        this.minRating = minRating;
    }

    public int getMinRating() {
        return minRating;
    }

    @Override
    public boolean apply(final Rating rating) {
        return rating.getValue() >= minRating;
    }

    public Iterator<Rating> filter(final Iterator<Rating> ratings) {
        Preconditions.checkArgument(ratings != null, "ratings is null");
        return Iterators.filter(ratings, this);
    }

    @Override
    public String toString() {
        return "RatingFilter[minRating:" + minRating + ']';
    }

}
