package org.codelibs.taste.writer;

import java.io.IOException;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.codelibs.taste.exception.NotFoundException;
import org.codelibs.taste.model.ItemCatalog;
import org.codelibs.taste.recommender.Recommendations;
import org.codelibs.taste.recommender.SimilarItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

/**
 * Renders {@link Recommendations} as plain text, resolving item names through an {@link ItemCatalog}.
 */
public class ResultFormatter {

    private static final Logger logger = LoggerFactory
            .getLogger(ResultFormatter.class);

    private static final String LINE_SEPARATOR = "\n";

    private static final String ITEM_RULE = StringUtils.repeat('-', 80);

    private static final String SECTION_RULE = StringUtils.repeat('=', 80);

    private final ItemCatalog catalog;

    public ResultFormatter(final ItemCatalog catalog) {
        Preconditions.checkArgument(catalog != null, "catalog is null");
        this.catalog = catalog;
    }

    public void write(final Recommendations recommendations, final int topN,
            final Appendable out) throws IOException {
        final String targetName = getItemName(recommendations
                .getTargetItemID());

        out.append("Top ").append(String.valueOf(topN))
                .append(" recommendations for ").append(targetName)
                .append(" based on Cosine Similarity score of ratings:")
                .append(LINE_SEPARATOR).append(LINE_SEPARATOR);
        writeItems(recommendations.getByScore(), out);

        out.append(SECTION_RULE).append(LINE_SEPARATOR);

        out.append("Top ").append(String.valueOf(topN))
                .append(" recommendations for ").append(targetName)
                .append(" based on the number of shared viewers:")
                .append(LINE_SEPARATOR).append(LINE_SEPARATOR);
        writeItems(recommendations.getBySupport(), out);
    }

    public String format(final Recommendations recommendations, final int topN) {
        final StringBuilder buf = new StringBuilder(1000);
        try {
            write(recommendations, topN, buf);
        } catch (final IOException e) {
            // StringBuilder does not throw
            throw new IllegalStateException(e);
        }
        return buf.toString();
    }

    protected void writeItems(final List<SimilarItem> items,
            final Appendable out) throws IOException {
        for (final SimilarItem item : items) {
            out.append(ITEM_RULE).append(LINE_SEPARATOR);
            out.append(String.valueOf(item.getSupportCount()))
                    .append(" viewers also watched:").append(LINE_SEPARATOR);
            out.append(getItemName(item.getItemID())).append(LINE_SEPARATOR);
            out.append("Similarity Score: ")
                    .append(String.valueOf(item.getScore()))
                    .append(LINE_SEPARATOR).append(LINE_SEPARATOR);
        }
    }

    protected String getItemName(final int itemID) {
        try {
            return catalog.getItemName(itemID);
        } catch (final NotFoundException e) {
            logger.warn("No name for item {}.", itemID);
            return "Item " + itemID;
        }
    }

}
