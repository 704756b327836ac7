package com.chih.JTemplate.core.format;

/**
 * 在块实例之间插入分隔符（最后一个实例之后不插入）
 * <p>
 * 参数中的 {@code NEWLINE} 和 {@code SPACE} 会被替换为换行和空格，
 * 因为这两个字符无法直接写在 Token 里。
 * </p>
 */
public class ListSeparatorFormatter extends BlockFormatter {

    private final String separator;

    public ListSeparatorFormatter(String value) {
        this.separator = value.replace("NEWLINE", "\n").replace("SPACE", " ");
    }

    @Override
    public String onBlockEnd(boolean isLast) {
        return isLast ? null : separator;
    }
}
