package com.deckflow.trigger.router;

import com.deckflow.types.common.Constants;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * 会话邮箱调度器。
 * <p>
 * 每个会话一个 FIFO 邮箱，同一会话的工作项串行执行，不同会话并行。
 * 会话存在未完成的协作方调用或退避时，input 工作项保持排队；
 * control 与内部工作项不受此限制。
 * </p>
 */
@Slf4j
@Component
public class SessionMailboxDispatcher {

    private final Executor executor;
    private final ConcurrentMap<String, Mailbox> mailboxes = new ConcurrentHashMap<>();

    public SessionMailboxDispatcher(@Qualifier("sessionWorkerExecutor") Executor executor) {
        this.executor = executor;
    }

    public void submit(String sessionId, WorkItem item) {
        Mailbox mailbox = mailboxes.computeIfAbsent(sessionId, Mailbox::new);
        boolean schedule;
        synchronized (mailbox) {
            mailbox.queue.addLast(item);
            schedule = !mailbox.draining && mailbox.hasEligible();
            if (schedule) {
                mailbox.draining = true;
            }
        }
        if (schedule) {
            schedule(mailbox);
        }
    }

    /**
     * 标记会话是否有未完成的协作方调用（含退避），忙碌期间 input 工作项不出队。
     */
    public void markBusy(String sessionId, boolean busy) {
        Mailbox mailbox = mailboxes.computeIfAbsent(sessionId, Mailbox::new);
        boolean schedule;
        synchronized (mailbox) {
            mailbox.busy = busy;
            schedule = !busy && !mailbox.draining && mailbox.hasEligible();
            if (schedule) {
                mailbox.draining = true;
            }
        }
        if (schedule) {
            schedule(mailbox);
        }
    }

    public boolean isBusy(String sessionId) {
        Mailbox mailbox = mailboxes.get(sessionId);
        if (mailbox == null) {
            return false;
        }
        synchronized (mailbox) {
            return mailbox.busy;
        }
    }

    /**
     * 会话销毁后丢弃剩余工作项。
     */
    public void remove(String sessionId) {
        Mailbox mailbox = mailboxes.remove(sessionId);
        if (mailbox == null) {
            return;
        }
        synchronized (mailbox) {
            mailbox.closed = true;
            if (!mailbox.queue.isEmpty()) {
                log.info("SESSION_MAILBOX_DISCARDED sessionId={}, pending={}", sessionId, mailbox.queue.size());
            }
            mailbox.queue.clear();
        }
    }

    public int pendingCount(String sessionId) {
        Mailbox mailbox = mailboxes.get(sessionId);
        if (mailbox == null) {
            return 0;
        }
        synchronized (mailbox) {
            return mailbox.queue.size();
        }
    }

    private void schedule(Mailbox mailbox) {
        try {
            executor.execute(() -> drain(mailbox));
        } catch (RejectedExecutionException ex) {
            log.warn("Session worker rejected drain, running inline. sessionId={}", mailbox.sessionId);
            drain(mailbox);
        }
    }

    private void drain(Mailbox mailbox) {
        while (true) {
            WorkItem item;
            synchronized (mailbox) {
                item = mailbox.closed ? null : mailbox.pollEligible();
                if (item == null) {
                    mailbox.draining = false;
                    return;
                }
            }
            run(mailbox.sessionId, item);
        }
    }

    private void run(String sessionId, WorkItem item) {
        MDC.put(Constants.MDC_SESSION_ID, sessionId);
        if (item.messageId() != null) {
            MDC.put(Constants.MDC_MESSAGE_ID, item.messageId());
        }
        try {
            item.task().run();
        } catch (RuntimeException ex) {
            log.error("SESSION_WORK_ITEM_FAILED sessionId={}, item={}, messageId={}, error={}",
                    sessionId, item.label(), item.messageId(), ex.getMessage(), ex);
        } finally {
            MDC.remove(Constants.MDC_SESSION_ID);
            MDC.remove(Constants.MDC_MESSAGE_ID);
        }
    }

    private static final class Mailbox {

        private final String sessionId;
        private final Deque<WorkItem> queue = new ArrayDeque<>();
        private boolean draining;
        private boolean busy;
        private boolean closed;

        private Mailbox(String sessionId) {
            this.sessionId = sessionId;
        }

        private boolean hasEligible() {
            for (WorkItem item : queue) {
                if (!item.gated() || !busy) {
                    return true;
                }
            }
            return false;
        }

        private WorkItem pollEligible() {
            Iterator<WorkItem> iterator = queue.iterator();
            while (iterator.hasNext()) {
                WorkItem item = iterator.next();
                if (!item.gated() || !busy) {
                    iterator.remove();
                    return item;
                }
            }
            return null;
        }
    }

    /**
     * 邮箱工作项。gated 为 true 的工作项在会话忙碌时保持排队。
     */
    public record WorkItem(String label, String messageId, boolean gated, Runnable task) {

        public static WorkItem input(String messageId, Runnable task) {
            return new WorkItem("input", messageId, true, task);
        }

        public static WorkItem control(String label, String messageId, Runnable task) {
            return new WorkItem(label, messageId, false, task);
        }

        public static WorkItem internal(String label, Runnable task) {
            return new WorkItem(label, null, false, task);
        }
    }
}
