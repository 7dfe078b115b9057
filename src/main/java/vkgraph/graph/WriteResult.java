package vkgraph.graph;

/** Outcome of a best-effort store write. A failed write is logged, never thrown. */
public record WriteResult(boolean applied, Exception error) {
    private static final WriteResult APPLIED = new WriteResult(true, null);

    public static WriteResult ok() {
        return APPLIED;
    }

    public static WriteResult failed(Exception error) {
        return new WriteResult(false, error);
    }
}
