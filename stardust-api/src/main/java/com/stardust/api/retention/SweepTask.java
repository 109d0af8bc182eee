package com.stardust.api.retention;

/**
 * A periodic background sweep.
 */
@FunctionalInterface
public interface SweepTask {

    SweepResult run();

    static SweepTask named(String name, SweepTask task) {
        return new SweepTask() {
            @Override
            public SweepResult run() {
                return task.run();
            }

            @Override
            public String name() {
                return name;
            }
        };
    }

    default String name() {
        return getClass().getSimpleName();
    }
}
