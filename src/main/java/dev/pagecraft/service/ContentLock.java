package dev.pagecraft.service;

import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * The structural lock shared by {@link PageTree}, {@link ComponentStore} and
 * {@link VersionManager}. Every mutation runs its checks and its changes inside
 * one write section; every read runs inside a read section, so readers observe
 * either the state before or after a mutation, never a mix.
 *
 * <p>The lock is reentrant and a writer may take the read side. A reader must
 * never ask for the write side.</p>
 */
public class ContentLock {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock(true);

    public <T> T read(Supplier<T> action) {
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    public <T> T write(Supplier<T> action) {
        lock.writeLock().lock();
        try {
            return action.get();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void execute(Runnable action) {
        lock.writeLock().lock();
        try {
            action.run();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean isWriteLockedByCurrentThread() {
        return lock.isWriteLockedByCurrentThread();
    }
}
