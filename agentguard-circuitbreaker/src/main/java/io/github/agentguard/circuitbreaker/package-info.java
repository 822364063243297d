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
@NonNullApi
@NonNullFields
package io.github.agentguard.circuitbreaker;

import io.github.agentguard.core.lang.NonNullApi;
import io.github.agentguard.core.lang.NonNullFields;

/**
 * 断路器
 * - 参数
 * -- failureThreshold        CLOSED 状态下连续失败次数达到该值时打开   默认：5
 * -- successThreshold        HALF_OPEN 状态下连续成功次数达到该值时关闭   默认：2
 * -- timeout                 断路器从 OPEN 到 HALF_OPEN 状态等待的时长   默认：30秒
 * -- maxConcurrentRequests   HALF_OPEN 状态下允许同时执行的试探请求数   默认：1
 * -- onStateChange           状态变化回调, 异步执行   默认：无
 * - 组合
 * -- MultiCircuitBreaker     按名称管理多个断路器, 汇总健康状态
 * -- CircuitBreakerGroup     多个断路器并行执行
 * -- retry / fallback / adaptive   重试 / 降级 / 错误率观测
 * <p>
 **/
