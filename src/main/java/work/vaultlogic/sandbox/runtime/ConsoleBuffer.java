package work.vaultlogic.sandbox.runtime;

import java.util.ArrayList;
import java.util.List;
import work.vaultlogic.sandbox.api.ConsoleEntry;
import work.vaultlogic.sandbox.api.ConsoleLevel;

/**
 * Invocation-scoped console capture. Keeps emission order and stops accepting entries at capacity.
 */
final class ConsoleBuffer {
    private final int capacity;
    private final List<ConsoleEntry> entries = new ArrayList<>();
    private int dropped;

    ConsoleBuffer(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity must not be negative");
        }
        this.capacity = capacity;
    }

    synchronized boolean append(ConsoleLevel level, List<Object> args) {
        if (entries.size() >= capacity) {
            dropped++;
            return false;
        }
        entries.add(new ConsoleEntry(level, args));
        return true;
    }

    synchronized List<ConsoleEntry> snapshot() {
        return List.copyOf(entries);
    }

    synchronized int dropped() {
        return dropped;
    }
}
