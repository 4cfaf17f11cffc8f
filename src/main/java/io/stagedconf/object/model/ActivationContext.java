package io.stagedconf.object.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects the items produced while evaluating compiled configuration until they are
 * committed. Items left over when the scope closes are dropped.
 */
public final class ActivationContext implements AutoCloseable {
    private final List<ConfigItem> items = new ArrayList<>();

    public synchronized void addItem(final ConfigItem item) {
        items.add(item);
    }

    /**
     * Returns and clears the pending items.
     */
    public synchronized List<ConfigItem> drainItems() {
        final List<ConfigItem> drained = new ArrayList<>(items);
        items.clear();
        return drained;
    }

    @Override
    public synchronized void close() {
        items.clear();
    }
}
