/*
 * Copyright [2013-2015] PayPal Software Foundation
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ml.shifu.eda.executor;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import ml.shifu.eda.exception.EdaErrorCode;
import ml.shifu.eda.exception.EdaException;
import ml.shifu.eda.util.Environment;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ExecutorManager} runs independent per-column tasks on a fixed thread pool.
 *
 * <p>
 * Results are returned in task submission order, so callers merging them see the same order as a sequential run.
 * With a pool size of 1 the tasks are run inline on the calling thread.
 */
public class ExecutorManager<T> {

    private static Logger LOG = LoggerFactory.getLogger(ExecutorManager.class);

    private final int threadPoolSize;

    private ExecutorService executorService = null;

    public ExecutorManager() {
        this(Environment.getInt(Environment.LOCAL_NUM_PARALLEL, 1));
    }

    public ExecutorManager(int threadPoolSize) {
        this.threadPoolSize = Math.max(1, threadPoolSize);
        if(this.threadPoolSize > 1) {
            this.executorService = Executors.newFixedThreadPool(this.threadPoolSize);
        }
    }

    /**
     * Submit all tasks and wait for all results.
     *
     * @throws EdaException
     *             {@link EdaErrorCode#ERROR_TASK_EXECUTION} if any task fails or waiting is interrupted
     */
    public List<T> submitTasksAndWaitResults(List<Callable<T>> tasks) {
        List<T> results = new ArrayList<T>(tasks.size());

        if(executorService == null) {
            for(Callable<T> task: tasks) {
                try {
                    results.add(task.call());
                } catch (EdaException e) {
                    throw e;
                } catch (Exception e) {
                    throw new EdaException(EdaErrorCode.ERROR_TASK_EXECUTION, e);
                }
            }
            return results;
        }

        List<Future<T>> futureList = new ArrayList<Future<T>>(tasks.size());
        for(Callable<T> task: tasks) {
            futureList.add(executorService.submit(task));
        }

        for(Future<T> future: futureList) {
            try {
                results.add(future.get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancelAll(futureList);
                throw new EdaException(EdaErrorCode.ERROR_TASK_EXECUTION, e, "Interrupted when waiting tasks.");
            } catch (ExecutionException e) {
                LOG.error("Error occurred, when waiting task to finish.", e.getCause());
                cancelAll(futureList);
                if(e.getCause() instanceof EdaException) {
                    throw (EdaException) e.getCause();
                }
                throw new EdaException(EdaErrorCode.ERROR_TASK_EXECUTION, e);
            }
        }

        return results;
    }

    private void cancelAll(List<Future<T>> futureList) {
        for(Future<T> future: futureList) {
            future.cancel(true);
        }
    }

    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    public void graceShutDown() {
        if(this.executorService == null) {
            return;
        }
        this.executorService.shutdown();
        try {
            this.executorService.awaitTermination(Integer.MAX_VALUE, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            LOG.error("Error occurred, when waiting task to finish.", e);
            Thread.currentThread().interrupt();
        }
    }
}
