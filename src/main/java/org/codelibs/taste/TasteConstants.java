package org.codelibs.taste;

public class TasteConstants {

    private TasteConstants() {
    }

    public static final String MIN_RATING = "min_rating";

    public static final String GROUPING = "grouping";

    public static final String NUM_OF_THREADS = "num_of_threads";

    public static final String BATCH_SIZE = "batch_size";

    public static final String MAX_DURATION = "max_duration";

    public static final String SCORE_THRESHOLD = "score_threshold";

    public static final String MIN_SUPPORT = "min_support";

    public static final String NUM_OF_ITEMS = "num_of_items";

    public static final int DEFAULT_MIN_RATING = 3;

    public static final int DEFAULT_NUM_OF_THREADS = 1;

    public static final int DEFAULT_BATCH_SIZE = 100;

    public static final int DEFAULT_MAX_DURATION = 0;

    public static final double DEFAULT_SCORE_THRESHOLD = 0.97;

    public static final int DEFAULT_MIN_SUPPORT = 50;

    public static final int DEFAULT_NUM_OF_ITEMS = 10;

    public static final String RATING_SEPARATOR = "\t";

    public static final String ITEM_SEPARATOR = "|";

    public static final String ITEM_CATALOG_ENCODING = "ISO-8859-1";
}
