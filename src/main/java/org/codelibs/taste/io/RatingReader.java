package org.codelibs.taste.io;

import java.io.Closeable;
import java.util.Iterator;

import org.codelibs.taste.model.Rating;

/**
 * A source of ratings. The returned iterator is lazy and can be consumed once.
 */
public interface RatingReader extends Closeable {

    Iterator<Rating> read();

}
