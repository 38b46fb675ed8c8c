package tickwork.scheduler.queue;

import tickwork.scheduler.model.Priority;
import tickwork.scheduler.model.ScheduledJob;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Thread-safe priority queue of jobs.
 * Ordered by priority weight (URGENT first), then insertion order.
 */
public final class JobPriorityQueue {

    private record Entry(int weight, long sequence, ScheduledJob job) {
    }

    private static final Comparator<Entry> ORDER = Comparator
            .comparingInt(Entry::weight)
            .thenComparingLong(Entry::sequence);

    private final TreeSet<Entry> entries = new TreeSet<>(ORDER);
    private long counter;

    public synchronized void push(ScheduledJob job) {
        entries.add(new Entry(job.priority().weight(), counter++, job));
    }

    public synchronized Optional<ScheduledJob> pop() {
        Entry first = entries.pollFirst();
        return first != null ? Optional.of(first.job()) : Optional.empty();
    }

    public synchronized Optional<ScheduledJob> peek() {
        return entries.isEmpty() ? Optional.empty() : Optional.of(entries.first().job());
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized boolean isEmpty() {
        return entries.isEmpty();
    }

    public synchronized void clear() {
        entries.clear();
    }

    public synchronized boolean contains(String jobId) {
        return entries.stream().anyMatch(e -> e.job().id().equals(jobId));
    }

    public synchronized boolean remove(String jobId) {
        return entries.removeIf(e -> e.job().id().equals(jobId));
    }

    /** Queued jobs of one priority, in queue order */
    public synchronized List<ScheduledJob> byPriority(Priority priority) {
        List<ScheduledJob> result = new ArrayList<>();
        for (Entry entry : entries) {
            if (entry.weight() == priority.weight()) {
                result.add(entry.job());
            }
        }
        return result;
    }
}
