package org.codelibs.taste.recommender;

import java.util.Map;

import org.codelibs.taste.TasteConstants;
import org.codelibs.taste.exception.InvalidParameterException;
import org.codelibs.taste.util.SettingsUtils;

public class QueryConfig {

    private double scoreThreshold = TasteConstants.DEFAULT_SCORE_THRESHOLD;

    private int minSupport = TasteConstants.DEFAULT_MIN_SUPPORT;

    private int topN = TasteConstants.DEFAULT_NUM_OF_ITEMS;

    public QueryConfig() {
    }

    public QueryConfig(final double scoreThreshold, final int minSupport,
            final int topN) {
        setScoreThreshold(scoreThreshold);
        setMinSupport(minSupport);
        setTopN(topN);
    }

    public static QueryConfig create(final Map<String, Object> settings) {
        final QueryConfig config = new QueryConfig();
        config.setScoreThreshold(SettingsUtils.getDouble(settings,
                TasteConstants.SCORE_THRESHOLD,
                TasteConstants.DEFAULT_SCORE_THRESHOLD));
        config.setMinSupport(SettingsUtils.getInt(settings,
                TasteConstants.MIN_SUPPORT, TasteConstants.DEFAULT_MIN_SUPPORT));
        config.setTopN(SettingsUtils.getInt(settings,
                TasteConstants.NUM_OF_ITEMS,
                TasteConstants.DEFAULT_NUM_OF_ITEMS));
        return config;
    }

    public double getScoreThreshold() {
        return scoreThreshold;
    }

    public void setScoreThreshold(final double scoreThreshold) {
        if (Double.isNaN(scoreThreshold)) {
            throw new InvalidParameterException(
                    "score_threshold is not a number.");
        }
        this.scoreThreshold = scoreThreshold;
    }

    public int getMinSupport() {
        return minSupport;
    }

    public void setMinSupport(final int minSupport) {
        this.minSupport = minSupport;
    }

    public int getTopN() {
        return topN;
    }

    public void setTopN(final int topN) {
        if (topN < 0) {
            throw new InvalidParameterException("num_of_items must be at least 0: "
                    + topN);
        }
        this.topN = topN;
    }

    @Override
    public String toString() {
        return "QueryConfig[scoreThreshold:" + scoreThreshold
                + ", minSupport:" + minSupport + ", topN:" + topN + ']';
    }

}
