package com.example.docfix;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/** 按 userId 分段的锁：同一用户的文档修改串行执行，不同用户大多互不阻塞 */
public class UserLocks {

    private final ReentrantLock[] stripes;

    public UserLocks(int stripes) {
        if (stripes <= 0) throw new IllegalArgumentException("stripes must be positive");
        this.stripes = new ReentrantLock[stripes];
        for (int i = 0; i < stripes; i++) this.stripes[i] = new ReentrantLock();
    }

    public <T> T withLock(long userId, Supplier<T> action) {
        ReentrantLock lock = stripes[Math.floorMod(Long.hashCode(userId), stripes.length)];
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
