package io.hostforge.provisioner.recovery;

/** How the sequencer continues after a failure has been handled. */
public enum Resolution {
    /** Run the step again, counting one more attempt. */
    RETRY,
    /** Run the step again with the attempt counter back at 1. */
    RETRY_FRESH,
    SKIP,
    SAVE_AND_EXIT,
    CANCEL
}
