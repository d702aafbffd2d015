package me.golemcore.agent.domain.system.toolloop;

/**
 * What the run loop does after a response was handled: finish with an output,
 * or call the model again.
 */
record ResponseAction<O>(boolean finished, O output, String outputToolName) {

    static <O> ResponseAction<O> finish(O output, String outputToolName) {
        return new ResponseAction<>(true, output, outputToolName);
    }

    static <O> ResponseAction<O> proceed() {
        return new ResponseAction<>(false, null, null);
    }
}
