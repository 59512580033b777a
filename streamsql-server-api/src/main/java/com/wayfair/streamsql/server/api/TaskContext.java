/**
 *  Copyright 2020 Wayfair LLC. All rights reserved.
 *  Licensed under the BSD 2-Clause License. See the LICENSE file in the project root for license information.
 *  See the NOTICE file in the project root for additional information regarding copyright ownership.
 */
package com.wayfair.streamsql.server.api;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Execution context of a task. The owner of the task ends its lifetime with {@link #cancel()}.
 * Long running operations poll {@link #isCancelled()}, and operations that block register a cancel
 * listener that wakes them up, e.g. by interrupting the waiting thread.
 */
public class TaskContext {
    private final String _taskId;
    private volatile boolean _cancelled;
    private final List<Runnable> _cancelListeners = new ArrayList<>();

    public TaskContext(final String taskId) {
        _taskId = taskId;
    }

    public TaskContext() {
        this(UUID.randomUUID().toString());
    }

    public String getTaskId() {
        return _taskId;
    }

    /**
     * Cancel the task and run the registered cancel listeners. Later calls have no effect.
     */
    public void cancel() {
        synchronized (_cancelListeners) {
            if (_cancelled) {
                return;
            }
            _cancelled = true;
            for (final Runnable listener : _cancelListeners) {
                listener.run();
            }
            _cancelListeners.clear();
        }
    }

    /**
     * Register a listener that runs once when the task is cancelled, right away if it already is.
     * Listeners run on the cancelling thread and must not block.
     */
    public void addCancelListener(final Runnable listener) {
        synchronized (_cancelListeners) {
            if (_cancelled) {
                listener.run();
            } else {
                _cancelListeners.add(listener);
            }
        }
    }

    /**
     * Unregister a cancel listener. Once this returns the listener is guaranteed not to run.
     * @return true if the listener was registered and has not run
     */
    public boolean removeCancelListener(final Runnable listener) {
        synchronized (_cancelListeners) {
            return _cancelListeners.remove(listener);
        }
    }

    public boolean isCancelled() {
        return _cancelled;
    }

    @Override
    public String toString() {
        return "TaskContext(" + _taskId + (_cancelled ? ", cancelled)" : ")");
    }
}
