package com.chih.JTemplate.core.text;

/**
 * 只读文本流
 * <p>
 * 模板扫描使用的游标，记录当前偏移量以及对应的行列号。
 * 支持单字符回退 ({@link #unget()}) 和预读 ({@link #peek()})，
 * 这是识别 <code>{{</code> 起始符所必需的。
 * </p>
 * <p>
 * 所有越界操作都属于调用方的契约错误，直接抛出 {@link IllegalStateException}
 * 或 {@link IllegalArgumentException}，不作为可恢复的模板错误处理。
 * </p>
 * <p>
 * 该类非线程安全，每次渲染都应创建新的实例。
 * </p>
 *
 * @author lizhiyuan
 * @since 2025/12/14
 */
public class TextStream {

    /**
     * 流结束标记
     */
    public static final int EOF = -1;

    private final String text;
    private final int length;
    private final String filename;

    private int offset;
    private int line;
    private int column;

    public TextStream(String text) {
        this(text, null);
    }

    public TextStream(String text, String filename) {
        this(text, filename, 1, 1);
    }

    /**
     * 创建一个起始位置不在 1:1 的流
     * <p>
     * 用于渲染块内容：块内容是原模板的一段子串，
     * 使用原模板中的起始行列号可以让错误信息指向真实位置。
     * </p>
     *
     * @param text 文本内容
     * @param filename 文件名（诊断用），可为 null
     * @param line 起始行号
     * @param column 起始列号
     */
    public TextStream(String text, String filename, int line, int column) {
        if (text == null) {
            throw new IllegalArgumentException("Text cannot be null");
        }
        if (line < 1 || column < 1) {
            throw new IllegalArgumentException("Line and column must be >= 1");
        }
        this.text = text;
        this.length = text.length();
        this.filename = filename;
        this.offset = 0;
        this.line = line;
        this.column = column;
    }

    /**
     * 读取一个字符并前移
     *
     * @return 字符，到达末尾时返回 {@link #EOF}
     */
    public int get() {
        if (offset >= length) {
            return EOF;
        }
        char c = text.charAt(offset++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    /**
     * 预读下一个字符，不移动读指针
     *
     * @return 字符，到达末尾时返回 {@link #EOF}
     */
    public int peek() {
        return offset < length ? text.charAt(offset) : EOF;
    }

    /**
     * 回退一个字符
     * <p>
     * 只用于重新读取刚刚读过的 <code>{</code>，不支持跨行回退。
     * </p>
     */
    public void unget() {
        if (offset <= 0) {
            throw new IllegalStateException("Read pointer is at the beginning");
        }
        if (text.charAt(offset - 1) == '\n') {
            throw new IllegalStateException("Cannot unget across a line break");
        }
        offset--;
        column--;
    }

    /**
     * 跳过若干字符（不解码换行）
     */
    public void skip(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Skip length must be >= 0: " + count);
        }
        if (offset + count > length) {
            throw new IllegalStateException("Skip beyond end of stream");
        }
        offset += count;
        column += count;
    }

    /**
     * 获取 [start, end) 之间的原始文本
     */
    public String substring(int start, int end) {
        if (start < 0 || end < start || end > length) {
            throw new IllegalArgumentException(
                    String.format("Invalid substring range [%d, %d) for length %d", start, end, length));
        }
        return text.substring(start, end);
    }

    public int getOffset() {
        return offset;
    }

    public SourcePosition getPosition() {
        return new SourcePosition(line, column, filename);
    }

    public String getFilename() {
        return filename;
    }

    public boolean isAtEnd() {
        return offset >= length;
    }
}
