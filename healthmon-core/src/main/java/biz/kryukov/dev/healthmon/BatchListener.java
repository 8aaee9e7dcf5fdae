package biz.kryukov.dev.healthmon;

/**
 * Callback invoked after a new batch has been installed in the result cache.
 *
 * <p>Implementations must be thread-safe and should return quickly.</p>
 */
@FunctionalInterface
public interface BatchListener {

    void onBatch(ResultBatch batch);
}
