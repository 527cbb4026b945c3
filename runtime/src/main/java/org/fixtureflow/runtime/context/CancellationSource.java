package org.fixtureflow.runtime.context;

import com.google.common.annotations.VisibleForTesting;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;
import org.fixtureflow.api.CancellationToken;
import org.fixtureflow.api.TestCanceledException;

/**
 * Write side of a {@link CancellationToken}. Cancellation is one-way: once requested it
 * stays requested and every registered callback runs exactly once.
 */
@Slf4j
public class CancellationSource implements CancellationToken {

    private final Object lock = new Object();

    private final List<Runnable> callbacks = new ArrayList<>();

    private volatile boolean canceled = false;

    @Nullable
    private volatile Registration parentRegistration;

    public void cancel() {
        List<Runnable> toRun;
        synchronized (lock) {
            if (canceled) {
                return;
            }
            canceled = true;
            toRun = new ArrayList<>(callbacks);
            callbacks.clear();
        }
        toRun.forEach(CancellationSource::invoke);
    }

    /**
     * Makes this source cancel whenever {@code parent} does.
     */
    public CancellationSource linkTo(CancellationToken parent) {
        parentRegistration = parent.register(this::cancel);
        return this;
    }

    /**
     * Stops following the parent given to {@link #linkTo}, so that a long lived parent does
     * not keep callbacks of finished work.
     */
    public void unlink() {
        Registration registration = parentRegistration;
        if (registration != null) {
            parentRegistration = null;
            registration.close();
        }
    }

    @Override
    public boolean isCancellationRequested() {
        return canceled;
    }

    @Override
    public void throwIfCancellationRequested() {
        if (canceled) {
            throw new TestCanceledException();
        }
    }

    @Override
    public Registration register(Runnable callback) {
        Runnable entry = callback::run;
        synchronized (lock) {
            if (!canceled) {
                callbacks.add(entry);
                return () -> unregister(entry);
            }
        }
        invoke(callback);
        return () -> { };
    }

    private void unregister(Runnable entry) {
        synchronized (lock) {
            callbacks.remove(entry);
        }
    }

    @VisibleForTesting
    public int registeredCallbacks() {
        synchronized (lock) {
            return callbacks.size();
        }
    }

    private static void invoke(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.warn("Cancellation callback failed", e);
        }
    }
}
