package org.codelibs.taste;

import java.util.Map;

import org.codelibs.taste.exception.InvalidParameterException;
import org.codelibs.taste.model.GroupingMode;
import org.codelibs.taste.util.SettingsUtils;

public class SimilarityConfig {

    private int minRating = TasteConstants.DEFAULT_MIN_RATING;

    private GroupingMode groupingMode = GroupingMode.FULL;

    private int numOfThreads = TasteConstants.DEFAULT_NUM_OF_THREADS;

    private int batchSize = TasteConstants.DEFAULT_BATCH_SIZE;

    private int maxDuration = TasteConstants.DEFAULT_MAX_DURATION;

    public static SimilarityConfig create(final Map<String, Object> settings) {
        final SimilarityConfig config = new SimilarityConfig();
        config.setMinRating(SettingsUtils.getInt(settings,
                TasteConstants.MIN_RATING, TasteConstants.DEFAULT_MIN_RATING));
        config.setGroupingMode(GroupingMode.of(SettingsUtils.getString(
                settings, TasteConstants.GROUPING, GroupingMode.FULL.name())));
        config.setNumOfThreads(SettingsUtils.getInt(settings,
                TasteConstants.NUM_OF_THREADS,
                TasteConstants.DEFAULT_NUM_OF_THREADS));
        config.setBatchSize(SettingsUtils.getInt(settings,
                TasteConstants.BATCH_SIZE, TasteConstants.DEFAULT_BATCH_SIZE));
        config.setMaxDuration(SettingsUtils.getInt(settings,
                TasteConstants.MAX_DURATION,
                TasteConstants.DEFAULT_MAX_DURATION));
        return config;
    }

    public int getMinRating() {
        return minRating;
    }

    public void setMinRating(final int minRating) {
        this.minRating = minRating;
    }

    public GroupingMode getGroupingMode() {
        return groupingMode;
    }

    public void setGroupingMode(final GroupingMode groupingMode) {
        if (groupingMode == null) {
            throw new InvalidParameterException("grouping is null.");
        }
        this.groupingMode = groupingMode;
    }

    public int getNumOfThreads() {
        return numOfThreads;
    }

    public void setNumOfThreads(final int numOfThreads) {
        if (numOfThreads < 1) {
            throw new InvalidParameterException(
                    "num_of_threads must be at least 1: " + numOfThreads);
        }
        this.numOfThreads = numOfThreads;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(final int batchSize) {
        if (batchSize < 1) {
            throw new InvalidParameterException(
                    "batch_size must be at least 1: " + batchSize);
        }
        this.batchSize = batchSize;
    }

    /**
     * @return time limit of an aggregation run in minutes, 0 for none
     */
    public int getMaxDuration() {
        return maxDuration;
    }

    public void setMaxDuration(final int maxDuration) {
        if (maxDuration < 0) {
            throw new InvalidParameterException(
                    "max_duration must be at least 0: " + maxDuration);
        }
        this.maxDuration = maxDuration;
    }

    @Override
    public String toString() {
        return "SimilarityConfig[minRating:" + minRating + ", grouping:"
                + groupingMode + ", numOfThreads:" + numOfThreads
                + ", batchSize:" + batchSize + ", maxDuration:" + maxDuration
                + ']';
    }

}
