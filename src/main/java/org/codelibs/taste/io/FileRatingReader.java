package org.codelibs.taste.io;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.codelibs.taste.TasteConstants;
import org.codelibs.taste.exception.MalformedRatingException;
import org.codelibs.taste.exception.TasteException;
import org.codelibs.taste.model.Rating;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.AbstractIterator;
import com.google.common.io.Closeables;

/**
 * <p>
 * Reads ratings from delimited text, one rating per line: user ID, item ID, rating and an optional timestamp,
 * tab separated by default as in the MovieLens {@code u.data} file. Blank lines are skipped; the timestamp is
 * checked but not kept.
 * </p>
 *
 * <p>
 * Lines are parsed while the iterator is consumed. A line that cannot be parsed fails with
 * {@link MalformedRatingException}.
 * </p>
 */
public class FileRatingReader implements RatingReader {

    private static final Logger log = LoggerFactory
            .getLogger(FileRatingReader.class);

    private final BufferedReader reader;

    private final Splitter splitter;

    private final String source;

    private boolean consumed = false;

    public FileRatingReader(final Path file) throws IOException {
        this(file, TasteConstants.RATING_SEPARATOR, StandardCharsets.UTF_8);
    }

    public FileRatingReader(final Path file, final String separator,
            final Charset charset) throws IOException {
        this(Files.newBufferedReader(file, charset), separator, file.toString());
    }

    public FileRatingReader(final Reader reader, final String separator,
            final String source) {
        Preconditions.checkArgument(reader != null, "reader is null");
        Preconditions.checkArgument(StringUtils.isNotEmpty(separator),
                "separator is empty");
        this.reader = reader instanceof BufferedReader ? (BufferedReader) reader
                : new BufferedReader(reader);
        splitter = Splitter.on(separator).trimResults();
        this.source = source;
    }

    @Override
    public Iterator<Rating> read() {
        Preconditions.checkState(!consumed, "%s is already read.", source);
        consumed = true;
        return new RatingIterator();
    }

    Rating parse(final String line, final long lineNumber) {
        final List<String> fields = splitter.splitToList(line);
        if (fields.size() < 3 || fields.size() > 4) {
            throw new MalformedRatingException(source + ":" + lineNumber
                    + ": expected 3 or 4 fields but found " + fields.size());
        }
        try {
            final int userID = Integer.parseInt(fields.get(0));
            final int itemID = Integer.parseInt(fields.get(1));
            final int value = Integer.parseInt(fields.get(2));
            if (fields.size() == 4) {
                Long.parseLong(fields.get(3));
            }
            return new Rating(userID, itemID, value);
        } catch (final NumberFormatException e) {
            throw new MalformedRatingException(source + ":" + lineNumber
                    + ": " + line, e);
        }
    }

    @Override
    public void close() throws IOException {
        Closeables.close(reader, true);
    }

    private class RatingIterator extends AbstractIterator<Rating> {

        private long lineNumber = 0;

        @Override
        protected Rating computeNext() {
            try {
                String line;
                while ((line = reader.readLine()) != null) {
                    lineNumber++;
                    if (StringUtils.isNotBlank(line)) {
                        return parse(line, lineNumber);
                    }
                }
            } catch (final IOException e) {
                throw new TasteException("Failed to read " + source, e);
            }
            log.info("Read {} lines from {}", lineNumber, source);
            return endOfData();
        }
    }

}
