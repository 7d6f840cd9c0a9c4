package com.vmturbo.cpu.metrics.api;

import java.util.Objects;
import java.util.Optional;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;

/**
 * What the engine needs to know about a thread: its process, and whether it is the per-CPU
 * idle (swapper) thread whose slices are not running time.
 */
public class ThreadInfo {

    private final long utid;
    private final Long upid;
    private final boolean idleThread;

    /**
     * Create a new thread description.
     *
     * @param utid       unique thread id
     * @param upid       unique id of the owning process, or null if unknown
     * @param idleThread true for the idle thread
     */
    public ThreadInfo(final long utid, @Nullable final Long upid, final boolean idleThread) {
        this.utid = utid;
        this.upid = upid;
        this.idleThread = idleThread;
    }

    /**
     * A regular thread belonging to a process.
     *
     * @param utid unique thread id
     * @param upid unique process id
     * @return the thread info
     */
    @Nonnull
    public static ThreadInfo ofProcess(final long utid, final long upid) {
        return new ThreadInfo(utid, upid, false);
    }

    /**
     * The idle thread.
     *
     * @param utid unique thread id
     * @return the thread info
     */
    @Nonnull
    public static ThreadInfo idle(final long utid) {
        return new ThreadInfo(utid, null, true);
    }

    public long getUtid() {
        return utid;
    }

    @Nonnull
    public Optional<Long> getUpid() {
        return Optional.ofNullable(upid);
    }

    public boolean isIdleThread() {
        return idleThread;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ThreadInfo)) {
            return false;
        }
        final ThreadInfo that = (ThreadInfo)o;
        return utid == that.utid && idleThread == that.idleThread && Objects.equals(upid, that.upid);
    }

    @Override
    public int hashCode() {
        return Objects.hash(utid, upid, idleThread);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("utid", utid)
                .add("upid", upid)
                .add("idleThread", idleThread)
                .toString();
    }
}
