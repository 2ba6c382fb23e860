package com.example.datasheet.util.document;

import org.jsoup.nodes.Element;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * 有界的文档顺序前向迭代器
 *
 * 从 start 之后的元素开始（包括 start 的子孙），最多返回 maxSteps 个元素。
 * 用显式计数代替递归，畸形文档树上也保证终止。
 */
public class ForwardElementWalker implements Iterator<Element> {

    private final int maxSteps;
    private int steps;
    private Element nextElement;

    public ForwardElementWalker(Element start, int maxSteps) {
        this.maxSteps = maxSteps;
        this.steps = 0;
        this.nextElement = DocumentOrder.next(start);
    }

    @Override
    public boolean hasNext() {
        return nextElement != null && steps < maxSteps;
    }

    @Override
    public Element next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        Element current = nextElement;
        steps++;
        nextElement = DocumentOrder.next(current);
        return current;
    }

    /** 已经走过的步数 */
    public int getSteps() {
        return steps;
    }
}
