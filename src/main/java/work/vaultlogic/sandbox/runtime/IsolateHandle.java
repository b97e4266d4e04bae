package work.vaultlogic.sandbox.runtime;

import java.util.concurrent.atomic.AtomicBoolean;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.PolyglotException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the context of one invocation and closes it exactly once, whichever side gets there first.
 */
final class IsolateHandle {
    private static final Logger LOG = LoggerFactory.getLogger(IsolateHandle.class);

    private final AtomicBoolean released = new AtomicBoolean();
    private volatile Context context;

    /**
     * Binds the freshly built context. Returns false (and cancels the context) when the invocation was
     * already terminated.
     */
    boolean attach(Context context) {
        this.context = context;
        if (released.get()) {
            closeQuietly(context, true);
            return false;
        }
        return true;
    }

    /** Forced close from the supervising thread; cancels running guest code. */
    boolean terminate() {
        if (!released.compareAndSet(false, true)) {
            return false;
        }
        Context current = context;
        if (current != null) {
            closeQuietly(current, true);
        }
        return true;
    }

    /** Normal close from the worker thread. */
    boolean release() {
        if (!released.compareAndSet(false, true)) {
            return false;
        }
        Context current = context;
        if (current != null) {
            closeQuietly(current, false);
        }
        return true;
    }

    private static void closeQuietly(Context context, boolean cancel) {
        try {
            context.close(cancel);
        } catch (PolyglotException | IllegalStateException ex) {
            LOG.debug("Sandbox context close reported: {}", ex.getMessage());
        }
    }
}
