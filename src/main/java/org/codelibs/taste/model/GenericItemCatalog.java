package org.codelibs.taste.model;

import java.util.Map;

import org.codelibs.taste.exception.NotFoundException;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

/**
 * An in-memory {@link ItemCatalog} backed by an immutable map.
 */
public final class GenericItemCatalog implements ItemCatalog {

    private final Map<Integer, String> names;

    public GenericItemCatalog(final Map<Integer, String> names) {
        Preconditions.checkArgument(names != null, "names is null");
        this.names = ImmutableMap.copyOf(names);
    }

    @Override
    public String getItemName(final int itemID) {
        final String name = names.get(itemID);
        if (name == null) {
            throw new NotFoundException("Item " + itemID + " is not found.");
        }
        return name;
    }

    @Override
    public boolean hasItem(final int itemID) {
        return names.containsKey(itemID);
    }

    @Override
    public int getNumItems() {
        return names.size();
    }

    @Override
    public String toString() {
        return "GenericItemCatalog[items:" + names.size() + ']';
    }

}
