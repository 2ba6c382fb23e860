package com.example.datasheet.util.document;

import org.jsoup.nodes.Element;

/**
 * 元素文档顺序（先序遍历）上的前驱/后继
 *
 * 只在 Element 之间移动，文本节点不计入。
 */
public final class DocumentOrder {

    private DocumentOrder() {
    }

    /**
     * 先序遍历中的下一个元素：先进入第一个子元素，否则找自己或祖先的下一个兄弟
     *
     * @return 下一个元素；已经是最后一个时返回 null
     */
    public static Element next(Element current) {
        if (current.childrenSize() > 0) {
            return current.child(0);
        }
        Element cursor = current;
        while (cursor != null) {
            Element sibling = cursor.nextElementSibling();
            if (sibling != null) {
                return sibling;
            }
            cursor = cursor.parent();
        }
        return null;
    }

    /**
     * 先序遍历中的上一个元素：前一个兄弟的最深最后子孙，否则父元素
     *
     * @return 上一个元素；已经是根时返回 null
     */
    public static Element previous(Element current) {
        Element sibling = current.previousElementSibling();
        if (sibling == null) {
            return current.parent();
        }
        Element cursor = sibling;
        while (cursor.childrenSize() > 0) {
            cursor = cursor.child(cursor.childrenSize() - 1);
        }
        return cursor;
    }

    /**
     * 向前查找最近的指定标签元素（祖先也在查找范围内）
     *
     * @return 找不到时返回 null
     */
    public static Element findPrevious(Element start, String... tagNames) {
        Element cursor = previous(start);
        while (cursor != null) {
            for (String tag : tagNames) {
                if (cursor.normalName().equals(tag)) {
                    return cursor;
                }
            }
            cursor = previous(cursor);
        }
        return null;
    }
}
