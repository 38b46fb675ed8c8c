package tickwork.scheduler.model;

/**
 * Job priority. Lower weight is served first.
 */
public enum Priority {
    LOW(3),
    NORMAL(2),
    HIGH(1),
    URGENT(0);

    private final int weight;

    Priority(int weight) {
        this.weight = weight;
    }

    public int weight() {
        return weight;
    }
}
