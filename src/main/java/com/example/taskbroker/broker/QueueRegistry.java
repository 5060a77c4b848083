package com.example.taskbroker.broker;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 已声明队列登记表
 *
 * <ul>
 *   <li>declared：已声明的主队列名</li>
 *   <li>pending：需要在 Broker 上（重新）声明的物理队列名，声明成功后移除</li>
 *   <li>delayQueues：已声明的延迟队列名</li>
 * </ul>
 * 所有修改都在同一把可重入锁内进行；读操作可以不加锁
 */
public class QueueRegistry {

    private final ReentrantLock lock = new ReentrantLock();
    private final Set<String> declared = ConcurrentHashMap.newKeySet();
    private final Set<String> pending = ConcurrentHashMap.newKeySet();
    private final Set<String> delayQueues = ConcurrentHashMap.newKeySet();

    public void withLock(Runnable action) {
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }

    public boolean isDeclared(String canonicalName) {
        return declared.contains(canonicalName);
    }

    public boolean isPending(String queueName) {
        return pending.contains(queueName);
    }

    /**
     * UNKNOWN → PENDING
     */
    public void markDeclared(String canonicalName, String delayQueueName) {
        assertLocked();
        declared.add(canonicalName);
        delayQueues.add(delayQueueName);
        pending.add(canonicalName);
    }

    public void markPending(String queueName) {
        assertLocked();
        pending.add(queueName);
    }

    /**
     * PENDING → ENSURED
     */
    public void markEnsured(String queueName) {
        assertLocked();
        pending.remove(queueName);
    }

    /**
     * 回到 UNKNOWN，下次使用时重新声明
     */
    public void forget(String canonicalName) {
        assertLocked();
        declared.remove(canonicalName);
    }

    public Set<String> getDeclared() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(declared));
    }

    public Set<String> getPending() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(pending));
    }

    public Set<String> getDelayQueues() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(delayQueues));
    }

    private void assertLocked() {
        if (!lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("必须在 withLock 内修改队列登记表");
        }
    }
}
