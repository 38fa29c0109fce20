/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.reportgrid.notify.sched;

/**
 * Handle for a task handed to {@link TaskScheduler#schedule}.
 */
public interface ScheduledTask {

    /**
     * Prevents the task from running if it has not run yet.
     *
     * @return true if this call cancelled the task
     */
    boolean cancel();

    /**
     * @return true once the task has run or has been cancelled
     */
    boolean isDone();
}
