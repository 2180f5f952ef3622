package com.mimecast.anomalymail.hook;

/**
 * Anomaly lifecycle hook interface.
 *
 * <p>Called by the detection engine on the detecting thread.
 * <p>Implementations must return normally: a failing notification may not abort detection.
 */
public interface AnomalyHook {

    /**
     * Gets hook name.
     *
     * @return Name string.
     */
    String getName();

    /**
     * Anomaly started.
     *
     * @param event AnomalyEvent instance.
     */
    void onAnomalyStart(AnomalyEvent event);

    /**
     * Anomaly ended.
     *
     * @param event AnomalyEvent instance.
     */
    void onAnomalyEnd(AnomalyEvent event);

    /**
     * Routes event by its kind.
     *
     * @param event AnomalyEvent instance.
     */
    default void handle(AnomalyEvent event) {
        switch (event.getKind()) {
            case ANOMALY_START:
                onAnomalyStart(event);
                break;
            case ANOMALY_END:
                onAnomalyEnd(event);
                break;
        }
    }
}
