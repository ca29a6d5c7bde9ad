package fun.fengwk.rp.core.service.browser.runtime;

/**
 * Browser worker states.
 *
 * @author fengwk
 */
public enum WorkerState {

    /**
     * Worker thread started, session not yet created.
     */
    STARTING,

    /**
     * Waiting for the next task.
     */
    IDLE,

    /**
     * Running exactly one task.
     */
    EXECUTING,

    /**
     * Loop exited after shutdown or failed session creation.
     */
    TERMINATED

}
