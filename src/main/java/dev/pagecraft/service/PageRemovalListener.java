package dev.pagecraft.service;

import java.util.Collection;

/**
 * Notified by {@link PageTree} while it still holds the write lock of a
 * delete, so dependent state disappears in the same critical section as the
 * pages themselves.
 */
@FunctionalInterface
public interface PageRemovalListener {

    void onPagesRemoved(Collection<Long> pageIds);
}
