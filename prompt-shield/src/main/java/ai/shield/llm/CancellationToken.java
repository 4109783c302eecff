package ai.shield.llm;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

public class CancellationToken {
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final Set<Future<?>> outstanding = ConcurrentHashMap.newKeySet();

    public void register(Future<?> future) {
        outstanding.add(future);
        if (cancelled.get()) {
            future.cancel(true);
        }
    }

    public void unregister(Future<?> future) {
        outstanding.remove(future);
    }

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            for (Future<?> future : outstanding) {
                future.cancel(true);
            }
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new RequestCancelledException("request cancelled");
        }
    }
}
