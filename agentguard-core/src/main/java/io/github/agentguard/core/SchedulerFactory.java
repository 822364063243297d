/*
 *
 *  Copyright 2025: the agentguard authors
 *
 *  Licensed under the Apache License, Version 2.0 (the "License");
 *  you may not use this file except in compliance with the License.
 *  You may obtain a copy of the License at
 *
 *         http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 *
 *
 */
package io.github.agentguard.core;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;

/**
 * Lazily created, process wide executors shared by every breaker that is not given its own.
 */
public class SchedulerFactory {

    private static final int SCHEDULER_POOL_SIZE = Math.max(2, Runtime.getRuntime().availableProcessors() / 2);

    private volatile ScheduledExecutorService scheduler;
    private volatile ExecutorService callExecutor;

    private SchedulerFactory() {
    }

    public static SchedulerFactory getInstance() {
        return SchedulerFactoryInstance.INSTANCE;
    }

    /**
     * @return the scheduler used for call deadlines and periodic tasks
     */
    public ScheduledExecutorService getScheduler() {
        // 双重检查, 首次使用时创建
        if (scheduler == null) {
            synchronized (this) {
                if (scheduler == null) {
                    ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(SCHEDULER_POOL_SIZE,
                        new NamingThreadFactory("agentguard-scheduler"));
                    // 取消的截止时间定时器立即出队
                    executor.setRemoveOnCancelPolicy(true);
                    scheduler = executor;
                }
            }
        }
        return scheduler;
    }

    /**
     * @return the unbounded pool running protected calls and observer notifications
     */
    public ExecutorService getCallExecutor() {
        if (callExecutor == null) {
            synchronized (this) {
                if (callExecutor == null) {
                    callExecutor = Executors.newCachedThreadPool(new NamingThreadFactory("agentguard-call"));
                }
            }
        }
        return callExecutor;
    }

    private static class SchedulerFactoryInstance {

        private static final SchedulerFactory INSTANCE = new SchedulerFactory();
    }
}
