package me.golemcore.agent.domain.system.toolloop;

/**
 * Observer of the blocking mode.
 */
public final class NoOpLoopObserver<O> implements LoopObserver<O> {

    private static final NoOpLoopObserver<?> INSTANCE = new NoOpLoopObserver<>();

    private NoOpLoopObserver() {
    }

    @SuppressWarnings("unchecked")
    public static <O> NoOpLoopObserver<O> instance() {
        return (NoOpLoopObserver<O>) INSTANCE;
    }
}
