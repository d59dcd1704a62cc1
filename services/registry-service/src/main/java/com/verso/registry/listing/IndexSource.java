package com.verso.registry.listing;

import java.util.List;

/**
 * Read access to one store index: values grouped under a key, in entity ID order.
 */
public interface IndexSource<V> {

    List<V> page(String key, PageRequest page);

    /**
     * Every value under the key, in store order.
     */
    List<V> all(String key);
}
