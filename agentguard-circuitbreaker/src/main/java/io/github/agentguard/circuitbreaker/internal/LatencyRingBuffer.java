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
package io.github.agentguard.circuitbreaker.internal;

/**
 * Fixed capacity buffer of latency samples in nanoseconds. Once full, every new sample evicts
 * the oldest one. Not thread safe, the owner synchronizes.
 */
class LatencyRingBuffer {

    private final long[] samples;
    /**
     * 下一个写入位置
     */
    private int head;
    /**
     * 已写入的样本数, 不超过容量
     */
    private int size;

    LatencyRingBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be greater than 0, was " + capacity);
        }
        this.samples = new long[capacity];
    }

    void add(long latencyNanos) {
        samples[head] = latencyNanos;
        head = (head + 1) % samples.length;
        if (size < samples.length) {
            size++;
        }
    }

    /**
     * @return a copy of the samples, oldest first
     */
    long[] toArray() {
        long[] copy = new long[size];
        if (size < samples.length) {
            System.arraycopy(samples, 0, copy, 0, size);
            return copy;
        }
        // 已写满: head 指向最旧的样本
        int tail = samples.length - head;
        System.arraycopy(samples, head, copy, 0, tail);
        System.arraycopy(samples, 0, copy, tail, head);
        return copy;
    }
}
