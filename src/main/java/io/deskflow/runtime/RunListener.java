package io.deskflow.runtime;

import io.deskflow.model.RunRecord;

@FunctionalInterface
public interface RunListener {
    void onRun(RunRecord record);
}
