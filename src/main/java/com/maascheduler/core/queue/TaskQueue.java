package com.maascheduler.core.queue;

import com.maascheduler.core.model.QueueItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.List;
import java.util.ListIterator;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * In-memory priority queue of pending run requests.
 * <p>
 * Items are ordered by ascending priority number; ties keep insertion order because a new item is
 * placed before the first item with a strictly larger priority. One lock serializes every operation,
 * so the timeline, the controller and the worker loop can mutate it concurrently.
 * <p>
 * The consumer takes one item at a time and settles it: it either {@linkplain #defer defers} the item
 * (it stays pending, hidden from {@link #poll} until {@link #restoreDeferred} or the next {@link #put})
 * or {@linkplain #settle settles} it before dispatch. Purges reach pending, deferred and taken items
 * alike; a purged taken item makes {@code settle} return false.
 */
@Component
public class TaskQueue {

    private static final Logger log = LoggerFactory.getLogger(TaskQueue.class);

    private final LinkedList<QueueItem> items = new LinkedList<>();
    private final List<QueueItem> deferred = new ArrayList<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();

    private QueueItem taken;
    private boolean takenPurged;

    /**
     * Adds an item. Deferred items go back into the queue first so that the new arrival is ordered
     * against them.
     */
    public void put(QueueItem item) {
        lock.lock();
        try {
            moveDeferredBack();
            insert(item);
            log.debug("Queued task {} (priority {}, origin {}), queue size {}",
                    item.taskId(), item.priority(), item.origin().label(), items.size());
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes and returns the head item without waiting.
     */
    public Optional<QueueItem> get() {
        lock.lock();
        try {
            return Optional.ofNullable(take(items.pollFirst()));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes and returns the head item, waiting up to {@code timeout} for one to arrive.
     *
     * @return the head item, or empty when the timeout elapsed first
     */
    public Optional<QueueItem> poll(long timeout, TimeUnit unit) throws InterruptedException {
        long remaining = unit.toNanos(timeout);
        lock.lock();
        try {
            while (items.isEmpty()) {
                if (remaining <= 0) {
                    return Optional.empty();
                }
                remaining = notEmpty.awaitNanos(remaining);
            }
            return Optional.of(take(items.removeFirst()));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Sets the taken item aside until {@link #restoreDeferred} or the next {@link #put}. The item is
     * dropped instead when it was purged after being taken.
     *
     * @return false when the item was dropped
     */
    public boolean defer(QueueItem item) {
        lock.lock();
        try {
            if (taken != null) {
                boolean purged = takenPurged;
                taken = null;
                takenPurged = false;
                if (purged) {
                    log.debug("Task {} was purged while taken, not deferring", item.taskId());
                    return false;
                }
            }
            deferred.add(item);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks the taken item as handed on.
     *
     * @return false when the item was purged after being taken and must not be dispatched
     */
    public boolean settle() {
        lock.lock();
        try {
            boolean purged = taken != null && takenPurged;
            taken = null;
            takenPurged = false;
            return !purged;
        } finally {
            lock.unlock();
        }
    }

    /** Returns deferred items to the queue. */
    public void restoreDeferred() {
        lock.lock();
        try {
            if (moveDeferredBack()) {
                notEmpty.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    public boolean hasDeferred() {
        lock.lock();
        try {
            return !deferred.isEmpty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops every item of the given task.
     *
     * @return number of items removed
     */
    public int remove(String taskId) {
        lock.lock();
        try {
            return removeWhere(item -> item.taskId().equals(taskId));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops every item whose task id is not in {@code validIds}.
     *
     * @return number of items removed
     */
    public int retain(Set<String> validIds) {
        lock.lock();
        try {
            return removeWhere(item -> !validIds.contains(item.taskId()));
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return number of items discarded
     */
    public int clear() {
        lock.lock();
        try {
            int size = items.size() + deferred.size();
            items.clear();
            deferred.clear();
            if (taken != null && !takenPurged) {
                takenPurged = true;
                size++;
            }
            return size;
        } finally {
            lock.unlock();
        }
    }

    public void putAll(Collection<QueueItem> batch) {
        for (QueueItem item : batch) {
            put(item);
        }
    }

    /** Number of pending items, deferred ones included. */
    public int size() {
        lock.lock();
        try {
            return items.size() + deferred.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public boolean contains(String taskId) {
        lock.lock();
        try {
            if (taken != null && !takenPurged && taken.taskId().equals(taskId)) {
                return true;
            }
            return items.stream().anyMatch(item -> item.taskId().equals(taskId))
                    || deferred.stream().anyMatch(item -> item.taskId().equals(taskId));
        } finally {
            lock.unlock();
        }
    }

    /** Copy of the pending items in dequeue order, deferred ones merged in by priority. */
    public List<QueueItem> snapshot() {
        lock.lock();
        try {
            List<QueueItem> all = new ArrayList<>(items);
            for (QueueItem item : deferred) {
                int index = 0;
                while (index < all.size() && all.get(index).priority() <= item.priority()) {
                    index++;
                }
                all.add(index, item);
            }
            return all;
        } finally {
            lock.unlock();
        }
    }

    private int removeWhere(Predicate<QueueItem> predicate) {
        int removed = removeFrom(items, predicate) + removeFrom(deferred, predicate);
        if (taken != null && !takenPurged && predicate.test(taken)) {
            takenPurged = true;
            removed++;
        }
        return removed;
    }

    private static int removeFrom(List<QueueItem> list, Predicate<QueueItem> predicate) {
        int removed = 0;
        Iterator<QueueItem> it = list.iterator();
        while (it.hasNext()) {
            if (predicate.test(it.next())) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    private QueueItem take(QueueItem item) {
        taken = item;
        takenPurged = false;
        return item;
    }

    private boolean moveDeferredBack() {
        if (deferred.isEmpty()) {
            return false;
        }
        for (QueueItem item : deferred) {
            insert(item);
        }
        deferred.clear();
        return true;
    }

    private void insert(QueueItem item) {
        ListIterator<QueueItem> it = items.listIterator();
        while (it.hasNext()) {
            if (it.next().priority() > item.priority()) {
                it.previous();
                it.add(item);
                return;
            }
        }
        items.addLast(item);
    }
}
