package org.codelibs.taste.model;

import org.codelibs.taste.exception.NotFoundException;

/**
 * Resolves item IDs to display names.
 */
public interface ItemCatalog {

    /**
     * @throws NotFoundException if the catalog has no item with this ID
     */
    String getItemName(int itemID);

    boolean hasItem(int itemID);

    int getNumItems();

}
