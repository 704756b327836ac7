package com.chih.JTemplate.core.format;

/**
 * 块格式化器
 * <p>
 * 块的每次展开（每个实例）都会依次触发：
 * {@link #onBlockBegin(boolean)} → 渲染块内容到临时缓冲区 → {@link #format(String)} → {@link #onBlockEnd(boolean)}。
 * 开始/结束钩子返回的字符串直接写入外层输出，不经过 {@link #format(String)}。
 * </p>
 */
public abstract class BlockFormatter extends Formatter {

    protected BlockFormatter() {
        super(FormatterType.BLOCK);
    }

    /**
     * 块实例展开前调用
     *
     * @param isFirst 是否为第一个实例
     * @return 需要前置输出的文本，null 表示不输出
     */
    public String onBlockBegin(boolean isFirst) {
        return null;
    }

    /**
     * 块实例展开后调用
     *
     * @param isLast 是否为最后一个实例
     * @return 需要追加输出的文本，null 表示不输出
     */
    public String onBlockEnd(boolean isLast) {
        return null;
    }

    /**
     * 处理一个块实例完整渲染后的文本
     */
    public String format(String block) {
        return block;
    }
}
