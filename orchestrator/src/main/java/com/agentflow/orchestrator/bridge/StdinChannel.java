package com.agentflow.orchestrator.bridge;

import java.io.OutputStream;
import java.util.function.BooleanSupplier;

/**
 * The agent process's standard input used as its input channel. Opening
 * never blocks; the pipe already exists once the process is spawned.
 */
public class StdinChannel implements InputChannel {

    private final Process process;

    public StdinChannel(Process process) {
        this.process = process;
    }

    @Override
    public OutputStream open(BooleanSupplier keepWaiting) {
        return process.getOutputStream();
    }

    @Override
    public String describe() {
        return "stdin:" + process.pid();
    }
}
