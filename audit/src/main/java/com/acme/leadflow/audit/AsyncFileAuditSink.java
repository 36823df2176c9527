package com.acme.leadflow.audit;

import com.acme.leadflow.audit.util.AuditDefaults;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * Async audit sink backed by one append-only JSON Lines file.
 *
 * <p>A single writer thread drains the queue and writes in batches. A batch is written
 * when it reaches {@code batchSize}, when {@code flushInterval} has passed since the
 * last write, or when {@link #flush(Duration)} asks for it. Line order is enqueue order.</p>
 */
public final class AsyncFileAuditSink implements AuditSink {
    private static final Logger LOG = Logger.getLogger(AsyncFileAuditSink.class.getName());

    private final Path file;
    private final LinkedBlockingQueue<AuditEvent> queue;
    private final int queueCapacity;
    private final OverflowPolicy overflowPolicy;
    private final int batchSize;
    private final long flushIntervalMs;
    private final LogRotator rotator;
    private final LineAppender appender;
    private final Consumer<AuditEvent> overflowListener;
    private final ReentrantLock fileLock = new ReentrantLock();
    private final AtomicBoolean running = new AtomicBoolean(true);
    private final AtomicLong enqueued = new AtomicLong();
    private final AtomicLong written = new AtomicLong();
    private final AtomicLong writeErrors = new AtomicLong();
    private final AtomicLong droppedEvents = new AtomicLong();
    private final Object flushMonitor = new Object();
    private final Thread writerThread;

    private volatile long flushRequested;
    private long flushCompleted;

    private AsyncFileAuditSink(Builder b) {
        this.file = Objects.requireNonNull(b.file, "file");
        this.queueCapacity = Math.max(0, b.queueCapacity);
        this.queue = queueCapacity > 0 ? new LinkedBlockingQueue<>(queueCapacity) : new LinkedBlockingQueue<>();
        this.overflowPolicy = b.overflowPolicy == null ? OverflowPolicy.DROP_NEWEST : b.overflowPolicy;
        this.batchSize = Math.max(1, b.batchSize);
        this.flushIntervalMs = Math.max(1L, b.flushIntervalMs);
        this.rotator = b.rotator;
        this.appender = b.appender == null ? LineAppender.FILE : b.appender;
        this.overflowListener = b.overflowListener;

        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (!Files.exists(file)) {
                Files.createFile(file);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Cannot open audit log " + file, e);
        }
        if (rotator != null) {
            rotator.sweepRetention(file, java.time.Instant.now());
        }

        this.writerThread = new Thread(this::writerLoop, "audit-log-writer");
        this.writerThread.setDaemon(true);
        this.writerThread.start();
    }

    public static Builder builder(Path file) {
        return new Builder(file);
    }

    @Override
    public void append(AuditEvent event) {
        if (event == null) {
            return;
        }
        if (!running.get()) {
            droppedEvents.incrementAndGet();
            LOG.fine("Audit event rejected after shutdown");
            return;
        }
        if (queue.offer(event)) {
            acceptOrWithdraw(event);
            return;
        }
        AuditEvent lost = event;
        if (overflowPolicy == OverflowPolicy.DROP_OLDEST) {
            AuditEvent evicted = queue.poll();
            if (queue.offer(event)) {
                acceptOrWithdraw(event);
                lost = evicted;
            }
        }
        if (lost != null) {
            droppedEvents.incrementAndGet();
            if (overflowListener != null) {
                try {
                    overflowListener.accept(lost);
                } catch (RuntimeException e) {
                    LOG.fine("Overflow listener failed: " + e.getClass().getSimpleName());
                }
            }
        }
    }

    /**
     * The writer may have made its final drain between the running check and the offer.
     * An event still in the queue after shutdown began is taken back and counted as dropped;
     * one already drained is written by the writer.
     */
    private void acceptOrWithdraw(AuditEvent event) {
        if (!running.get() && queue.remove(event)) {
            droppedEvents.incrementAndGet();
            LOG.fine("Audit event rejected after shutdown");
            return;
        }
        enqueued.incrementAndGet();
    }

    @Override
    public boolean flush(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        long target;
        synchronized (flushMonitor) {
            target = ++flushRequested;
        }
        synchronized (flushMonitor) {
            while (flushCompleted < target) {
                if (!writerThread.isAlive()) {
                    return queue.isEmpty();
                }
                long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (remainingMs <= 0) {
                    return false;
                }
                try {
                    flushMonitor.wait(remainingMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }
            return true;
        }
    }

    public boolean flush() {
        return flush(Duration.ofMillis(AuditDefaults.DEFAULT_FLUSH_TIMEOUT_MS));
    }

    public Path file() {
        return file;
    }

    public int queueDepth() {
        return queue.size();
    }

    public long enqueuedCount() {
        return enqueued.get();
    }

    public long writtenCount() {
        return written.get();
    }

    public long writeErrorCount() {
        return writeErrors.get();
    }

    public long droppedCount() {
        return droppedEvents.get();
    }

    public int queueCapacity() {
        return queueCapacity;
    }

    private void writerLoop() {
        List<AuditEvent> pending = new ArrayList<>(batchSize);
        long lastWriteNanos = System.nanoTime();
        try {
            while (running.get() || !queue.isEmpty()) {
                try {
                    AuditEvent event = queue.poll(AuditDefaults.WRITER_POLL_MS, TimeUnit.MILLISECONDS);
                    if (event != null) {
                        pending.add(event);
                        queue.drainTo(pending, Math.max(0, batchSize - pending.size()));
                    }
                    long requested = flushRequested;
                    boolean flushDue = requested > completedGeneration();
                    long now = System.nanoTime();
                    boolean intervalDue = now - lastWriteNanos >= TimeUnit.MILLISECONDS.toNanos(flushIntervalMs);
                    if (flushDue || pending.size() >= batchSize || (intervalDue && !pending.isEmpty())) {
                        if (flushDue) {
                            queue.drainTo(pending);
                        }
                        writeBatch(pending);
                        pending.clear();
                        lastWriteNanos = now;
                        if (flushDue) {
                            markFlushed(requested);
                        }
                    } else if (intervalDue) {
                        lastWriteNanos = now;
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                } catch (RuntimeException e) {
                    writeErrors.addAndGet(Math.max(1, pending.size()));
                    LOG.warning("Audit writer iteration failed, " + pending.size() + " event(s) lost: "
                        + e.getClass().getSimpleName());
                    pending.clear();
                }
            }
        } finally {
            queue.drainTo(pending);
            if (!pending.isEmpty()) {
                writeBatch(pending);
            }
            markFlushed(flushRequested);
        }
    }

    /**
     * Whole batch, then the whole batch once more, then event by event. Before each retry
     * the file is cut back to its size before the failed attempt. An event that still fails
     * is counted and dropped.
     */
    void writeBatch(List<AuditEvent> batch) {
        if (batch.isEmpty()) {
            return;
        }
        List<String> lines = new ArrayList<>(batch.size());
        for (AuditEvent event : batch) {
            try {
                lines.add(event.toJsonLine());
            } catch (UncheckedIOException e) {
                writeErrors.incrementAndGet();
                LOG.warning("Audit event serialization failed: " + e.getClass().getSimpleName());
            }
        }
        if (lines.isEmpty()) {
            return;
        }
        fileLock.lock();
        try {
            rotateIfNeeded();
            for (int attempt = 1; attempt <= 2; attempt++) {
                long sizeBefore = currentSize();
                try {
                    appender.append(file, lines);
                    written.addAndGet(lines.size());
                    return;
                } catch (IOException e) {
                    LOG.warning("Audit batch write failed (attempt " + attempt + "): " + e.getClass().getSimpleName());
                    restoreSize(sizeBefore);
                }
            }
            for (String line : lines) {
                long sizeBefore = currentSize();
                try {
                    appender.append(file, List.of(line));
                    written.incrementAndGet();
                } catch (IOException e) {
                    writeErrors.incrementAndGet();
                    LOG.warning("Audit event write failed, event dropped: " + e.getClass().getSimpleName());
                    restoreSize(sizeBefore);
                }
            }
        } finally {
            fileLock.unlock();
        }
    }

    private long currentSize() {
        try {
            return Files.size(file);
        } catch (IOException e) {
            return -1L;
        }
    }

    /** Cuts off whatever a failed append left behind. */
    private void restoreSize(long size) {
        if (size < 0L) {
            return;
        }
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.WRITE)) {
            if (channel.size() > size) {
                channel.truncate(size);
            }
        } catch (IOException e) {
            LOG.warning("Audit log truncate after failed write failed: " + e.getClass().getSimpleName());
        }
    }

    private void rotateIfNeeded() {
        if (rotator == null || !rotator.rotationNeeded(file)) {
            return;
        }
        try {
            rotator.rotate(file);
        } catch (IOException e) {
            LOG.warning("Audit log rotation failed, continuing on current file: " + e.getClass().getSimpleName());
        }
    }

    private long completedGeneration() {
        synchronized (flushMonitor) {
            return flushCompleted;
        }
    }

    private void markFlushed(long generation) {
        synchronized (flushMonitor) {
            if (generation > flushCompleted) {
                flushCompleted = generation;
            }
            flushMonitor.notifyAll();
        }
    }

    /**
     * Stops accepting events, writes what is queued and waits for the writer.
     *
     * @return {@code true} if the writer finished within {@code timeout}
     */
    public boolean shutdown(Duration timeout) {
        running.set(false);
        try {
            writerThread.join(Math.max(1L, timeout.toMillis()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        boolean finished = !writerThread.isAlive();
        if (!finished) {
            LOG.warning("Audit writer did not finish within " + timeout.toMillis() + " ms; "
                + queue.size() + " event(s) still queued");
        }
        return finished;
    }

    @Override
    public void close() {
        shutdown(Duration.ofMillis(AuditDefaults.DEFAULT_SHUTDOWN_TIMEOUT_MS));
    }

    public static final class Builder {
        private final Path file;
        private int batchSize = AuditDefaults.DEFAULT_BATCH_SIZE;
        private long flushIntervalMs = AuditDefaults.DEFAULT_FLUSH_INTERVAL_MS;
        private int queueCapacity;
        private OverflowPolicy overflowPolicy = OverflowPolicy.DROP_NEWEST;
        private LogRotator rotator;
        private LineAppender appender;
        private Consumer<AuditEvent> overflowListener;

        private Builder(Path file) {
            this.file = file;
        }

        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder flushIntervalMs(long flushIntervalMs) {
            this.flushIntervalMs = flushIntervalMs;
            return this;
        }

        /** Zero or less means unbounded. */
        public Builder queueCapacity(int queueCapacity, OverflowPolicy overflowPolicy) {
            this.queueCapacity = queueCapacity;
            this.overflowPolicy = overflowPolicy;
            return this;
        }

        public Builder rotator(LogRotator rotator) {
            this.rotator = rotator;
            return this;
        }

        public Builder appender(LineAppender appender) {
            this.appender = appender;
            return this;
        }

        public Builder overflowListener(Consumer<AuditEvent> overflowListener) {
            this.overflowListener = overflowListener;
            return this;
        }

        public AsyncFileAuditSink build() {
            return new AsyncFileAuditSink(this);
        }
    }
}
