package com.chih.JTemplate.core.format;

/**
 * 使用制表符缩进块内容
 * <p>
 * 每个实例前输出 depth 个制表符，块内部的每个换行后同样补齐缩进。
 * </p>
 */
public class IndentFormatter extends BlockFormatter {

    private final String tabs;

    public IndentFormatter(int depth) {
        if (depth < 0) {
            throw new IllegalArgumentException("Indent depth must be >= 0: " + depth);
        }
        this.tabs = "\t".repeat(depth);
    }

    @Override
    public String onBlockBegin(boolean isFirst) {
        return tabs;
    }

    @Override
    public String format(String block) {
        return block.replace("\n", "\n" + tabs);
    }
}
