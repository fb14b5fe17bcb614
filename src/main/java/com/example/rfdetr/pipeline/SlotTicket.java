package com.example.rfdetr.pipeline;

/**
 * 队列中流转的消息：要么携带一个槽位索引，要么是关闭信号。
 * 关闭信号是独立的单例，不会与任何合法索引冲突。
 */
public final class SlotTicket {

    public static final SlotTicket SHUTDOWN = new SlotTicket(-1);

    private final int index;

    private SlotTicket(int index) {
        this.index = index;
    }

    public static SlotTicket of(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("槽位索引不能为负数: " + index);
        }
        return new SlotTicket(index);
    }

    public boolean isShutdown() {
        return this == SHUTDOWN;
    }

    public int getIndex() {
        if (isShutdown()) {
            throw new IllegalStateException("关闭信号不携带槽位索引");
        }
        return index;
    }

    @Override
    public String toString() {
        return isShutdown() ? "SlotTicket{SHUTDOWN}" : "SlotTicket{" + index + "}";
    }
}
