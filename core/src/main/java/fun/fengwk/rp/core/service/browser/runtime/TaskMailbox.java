package fun.fengwk.rp.core.service.browser.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Unbounded FIFO queue of pending browser tasks.
 *
 * <p>Many threads enqueue, only the worker thread takes. Tasks are never reordered or dropped.
 *
 * @author fengwk
 */
class TaskMailbox {

    private static final Logger log = LoggerFactory.getLogger(TaskMailbox.class);

    private final BlockingQueue<TaskHolder<?>> queue = new LinkedBlockingQueue<>();
    private final int warnSize;
    private final AtomicBoolean aboveWarnSize = new AtomicBoolean(false);

    TaskMailbox(int warnSize) {
        this.warnSize = warnSize;
    }

    /**
     * Add a task. Warns once each time the size crosses {@code warnSize} upwards.
     */
    void enqueue(TaskHolder<?> holder) {
        queue.add(holder);
        if (warnSize > 0) {
            int size = queue.size();
            if (size > warnSize && aboveWarnSize.compareAndSet(false, true)) {
                log.warn("browser task mailbox is growing, size={}, warnSize={}", size, warnSize);
            }
        }
    }

    TaskHolder<?> take() throws InterruptedException {
        TaskHolder<?> holder = queue.take();
        resetWarning();
        return holder;
    }

    List<TaskHolder<?>> drain() {
        List<TaskHolder<?>> pending = new ArrayList<>();
        queue.drainTo(pending);
        resetWarning();
        return pending;
    }

    boolean isAboveWarnSize() {
        return aboveWarnSize.get();
    }

    int size() {
        return queue.size();
    }

    private void resetWarning() {
        if (queue.size() <= warnSize) {
            aboveWarnSize.set(false);
        }
    }

}
