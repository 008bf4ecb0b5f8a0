package org.codelibs.taste.io;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;
import org.codelibs.taste.TasteConstants;
import org.codelibs.taste.exception.TasteException;
import org.codelibs.taste.model.GenericItemCatalog;
import org.codelibs.taste.model.ItemCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Splitter;

/**
 * Loads an {@link ItemCatalog} from a MovieLens {@code u.item} style file: pipe separated, the item ID and its
 * name in the first two fields, ISO-8859-1 encoded.
 */
public final class FileItemCatalogReader {

    private static final Logger log = LoggerFactory
            .getLogger(FileItemCatalogReader.class);

    private static final Splitter SPLITTER = Splitter.on(
            TasteConstants.ITEM_SEPARATOR).limit(3);

    private FileItemCatalogReader() {
    }

    public static ItemCatalog read(final Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file,
                Charset.forName(TasteConstants.ITEM_CATALOG_ENCODING))) {
            return read(reader, file.toString());
        }
    }

    public static ItemCatalog read(final Reader reader, final String source)
            throws IOException {
        final BufferedReader bufferedReader = reader instanceof BufferedReader ? (BufferedReader) reader
                : new BufferedReader(reader);
        final Map<Integer, String> names = new HashMap<Integer, String>();
        long lineNumber = 0;
        String line;
        while ((line = bufferedReader.readLine()) != null) {
            lineNumber++;
            if (StringUtils.isBlank(line)) {
                continue;
            }
            final Iterator<String> fields = SPLITTER.split(line).iterator();
            final String id = fields.next().trim();
            if (!fields.hasNext()) {
                throw new TasteException(source + ":" + lineNumber
                        + ": no item name in " + line);
            }
            try {
                names.put(Integer.parseInt(id), fields.next().trim());
            } catch (final NumberFormatException e) {
                throw new TasteException(source + ":" + lineNumber
                        + ": invalid item ID " + id, e);
            }
        }
        log.info("Loaded {} item names from {}", names.size(), source);
        return new GenericItemCatalog(names);
    }

}
