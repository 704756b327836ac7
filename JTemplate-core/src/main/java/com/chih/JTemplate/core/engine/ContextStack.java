package com.chih.JTemplate.core.engine;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Map;

/**
 * 上下文栈
 * <p>
 * 查找从最内层（最后压入）向外进行，内层同名变量遮蔽外层变量，
 * 内层没有时回退到外层。一次渲染一个栈，非线程安全。
 * </p>
 *
 * @author lizhiyuan
 * @since 2025/12/14
 */
public class ContextStack {

    private final Deque<ContextFrame> frames = new ArrayDeque<>();

    public ContextStack(Map<String, ?> root) {
        frames.push(ContextFrame.root(root));
    }

    public void push(ContextFrame frame) {
        frames.push(frame);
    }

    public ContextFrame pop() {
        if (frames.size() <= 1) {
            throw new IllegalStateException("Cannot pop the root frame");
        }
        return frames.pop();
    }

    /**
     * 从内向外查找包含该名称的帧
     *
     * @return 找到的帧，没有时返回 null
     */
    public ContextFrame find(String name) {
        Iterator<ContextFrame> it = frames.iterator();
        while (it.hasNext()) {
            ContextFrame frame = it.next();
            if (frame.contains(name)) {
                return frame;
            }
        }
        return null;
    }

    public int depth() {
        return frames.size();
    }
}
