package com.example.rfdetr.pipeline;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;

/**
 * 有界阻塞FIFO队列，用于空闲槽位回收和阶段间交接。
 * <p>
 * push() 在队列满时阻塞，pop() 在队列空时阻塞，这就是流水线的背压机制。
 * 关闭流水线依靠显式的 {@link SlotTicket#SHUTDOWN}，而不是关闭队列。
 */
public class BoundedQueue<T> {

    private final BlockingQueue<T> queue;
    private final int capacity;

    public BoundedQueue(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("队列容量必须大于0: " + capacity);
        }
        this.capacity = capacity;
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    /**
     * 追加元素，队列满时阻塞直到有空位
     */
    public void push(T item) throws InterruptedException {
        queue.put(item);
    }

    /**
     * 取出最早的元素，队列空时阻塞直到有数据
     */
    public T pop() throws InterruptedException {
        return queue.take();
    }

    /**
     * 非阻塞追加，队列满时返回false。只在关闭流水线时使用。
     */
    public boolean offer(T item) {
        return queue.offer(item);
    }

    public int size() {
        return queue.size();
    }

    public int getCapacity() {
        return capacity;
    }
}
