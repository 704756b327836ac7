package com.chih.JTemplate.core.engine;

import com.chih.JTemplate.core.Template;
import com.chih.JTemplate.core.exception.InvalidBlockException;
import com.chih.JTemplate.core.exception.PathResolutionException;
import com.chih.JTemplate.core.exception.TemplateException;
import com.chih.JTemplate.core.exception.TemplateNotFoundException;
import com.chih.JTemplate.core.exception.TemplateRecursionException;
import com.chih.JTemplate.core.format.BlockFormatter;
import com.chih.JTemplate.core.format.ValueFormatter;
import com.chih.JTemplate.core.spi.IncludeResolver;
import com.chih.JTemplate.core.text.SourcePosition;
import com.chih.JTemplate.core.text.TextStream;
import com.chih.JTemplate.core.token.Token;
import com.chih.JTemplate.core.token.TokenKind;
import com.chih.JTemplate.core.token.TokenReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 模板渲染器（递归展开）
 * <p>
 * 逐字符扫描输入，普通文本原样输出；遇到 Token 时按类型分派：
 * </p>
 * <ul>
 *   <li>变量 / 自引用：沿上下文栈由内向外查找根名称，再逐段解析复合路径，依次应用值格式化器</li>
 *   <li>块 / 取反块：用 {@link BlockMatcher} 定位块体，按实例迭代，每个实例压入一帧后递归渲染</li>
 *   <li>命名字符：输出对应字符</li>
 *   <li>包含：通过 {@link IncludeResolver} 获取模板，在同一个上下文栈上渲染</li>
 * </ul>
 * <p>
 * 根名称找不到时输出为空，不是错误；根名称找到后路径中任何一段失败都会抛出
 * {@link PathResolutionException}。
 * </p>
 * <p>
 * 每次渲染新建一个实例，非线程安全。
 * </p>
 *
 * @author lizhiyuan
 * @since 2025/12/14
 */
public class TemplateRenderer {

    private static final Logger log = LoggerFactory.getLogger(TemplateRenderer.class);

    private static final String[] NO_PATH = new String[0];

    private final ContextStack stack;

    private final int maxIncludeDepth;

    public TemplateRenderer(Map<String, ?> context, int maxIncludeDepth) {
        this.stack = new ContextStack(context);
        this.maxIncludeDepth = maxIncludeDepth;
    }

    /**
     * 渲染模板到输出
     */
    public void render(Template template, OutputSink out) {
        render(new TextStream(template.getSource(), template.getFilename()), out, template.getResolver(), 0);
    }

    private void render(TextStream in, OutputSink out, IncludeResolver resolver, int depth) {
        StringBuilder text = new StringBuilder();
        while (!in.isAtEnd()) {
            int current = in.get();
            if (!TokenReader.isTokenStart(current, in)) {
                text.append((char) current);
                continue;
            }
            if (text.length() > 0) {
                out.write(text);
                text.setLength(0);
            }
            in.unget();
            Token token = TokenReader.read(in);
            switch (token.getKind()) {
                case VALUE:
                case SELF_REFERENCE:
                    expandValue(token, out);
                    break;
                case BLOCK_OPEN:
                case NEGATED_BLOCK_OPEN:
                    expandBlock(token, in, out, resolver, depth);
                    break;
                case NAMED_CHARACTER:
                    out.write(token.evaluateNamedCharacter());
                    break;
                case INCLUDE:
                    expandInclude(token, out, resolver, depth);
                    break;
                case BLOCK_CLOSE:
                    throw new InvalidBlockException(
                            String.format("Block end '%s' has no matching block start", token.getName()),
                            token.getPosition());
                default:
                    throw new IllegalStateException("Unhandled token kind: " + token.getKind());
            }
        }
        if (text.length() > 0) {
            out.write(text);
        }
    }

    private void expandValue(Token token, OutputSink out) {
        log.debug("Expanding variable '{}'", token.getName());
        Lookup lookup = lookup(token, false);
        if (!lookup.found()) {
            return;
        }
        Object value = lookup.value();
        for (ValueFormatter formatter : token.getValueFormatters()) {
            try {
                value = formatter.format(value);
            } catch (IllegalArgumentException e) {
                throw new TemplateException(
                        String.format("Cannot format '%s': %s", token.getName(), e.getMessage()),
                        token.getPosition(), e);
            }
        }
        if (value == null) {
            log.warn("Value of '{}' at {} is null, nothing rendered", token.getName(), token.getPosition());
            return;
        }
        out.write(String.valueOf(value));
    }

    private void expandBlock(Token open, TextStream in, OutputSink out, IncludeResolver resolver, int depth) {
        SourcePosition bodyPosition = in.getPosition();
        Token close = BlockMatcher.findEnd(in, open);
        String body = in.substring(open.getEnd(), close.getStart());

        boolean negated = open.getKind() == TokenKind.NEGATED_BLOCK_OPEN;
        Lookup lookup = lookup(open, true);

        List<Object> instances;
        if (!lookup.found()) {
            if (!negated) {
                return;
            }
            instances = Collections.singletonList(Collections.emptyMap());
        } else if (lookup.value() == null) {
            instances = Collections.singletonList(Collections.emptyMap());
        } else if (negated) {
            return;
        } else {
            instances = BlockInstances.normalize(lookup.value());
        }
        log.debug("Expanding block '{}' with {} instance(s)", open.getName(), instances.size());

        List<BlockFormatter> formatters = open.getBlockFormatters();
        int count = instances.size();
        for (int i = 0; i < count; i++) {
            boolean isFirst = i == 0;
            boolean isLast = i + 1 == count;
            for (BlockFormatter formatter : formatters) {
                writeIfPresent(out, formatter.onBlockBegin(isFirst));
            }

            stack.push(ContextFrame.instance(open.getName(), instances.get(i), i, count));
            try {
                TextStream bodyStream = new TextStream(body, in.getFilename(),
                        bodyPosition.line(), bodyPosition.column());
                if (formatters.isEmpty()) {
                    render(bodyStream, out, resolver, depth);
                } else {
                    BufferedSink buffer = new BufferedSink();
                    render(bodyStream, buffer, resolver, depth);
                    String block = buffer.toString();
                    for (BlockFormatter formatter : formatters) {
                        block = formatter.format(block);
                    }
                    out.write(block);
                }
            } finally {
                stack.pop();
            }

            for (BlockFormatter formatter : formatters) {
                writeIfPresent(out, formatter.onBlockEnd(isLast));
            }
        }
    }

    private void expandInclude(Token token, OutputSink out, IncludeResolver resolver, int depth) {
        log.debug("Expanding include '{}'", token.getName());
        if (resolver == null) {
            throw new IllegalStateException("Cannot resolve includes without an include resolver");
        }
        if (depth >= maxIncludeDepth) {
            throw new TemplateRecursionException(
                    String.format("Include depth limit %d exceeded while including '%s'",
                            maxIncludeDepth, token.getName()),
                    token.getPosition());
        }
        Template included = resolver.get(token.getName());
        if (included == null) {
            throw new TemplateNotFoundException(token.getName());
        }
        IncludeResolver nested = included.getResolver() != null ? included.getResolver() : resolver;
        render(new TextStream(included.getSource(), included.getFilename()), out, nested, depth + 1);
    }

    /**
     * 查找 Token 名称对应的值
     *
     * @param block 为 true 且名称含 {@code #} 时按完整名称查找实例标记（如 {@code a.b#First}），
     *              不拆分路径；其他名称一律按复合路径解析，块与变量一致
     */
    private Lookup lookup(Token token, boolean block) {
        String name = token.getName();
        String root;
        String[] path;
        if (token.isSelfReference()) {
            root = ContextFrame.SELF;
            path = name.length() > 1 ? PathResolver.split(name.substring(1)) : NO_PATH;
        } else if (block && name.indexOf(ContextFrame.MARKER_SEPARATOR) >= 0) {
            root = name;
            path = NO_PATH;
        } else {
            String[] parts = PathResolver.split(name);
            root = parts[0];
            path = new String[parts.length - 1];
            System.arraycopy(parts, 1, path, 0, path.length);
        }

        ContextFrame frame = stack.find(root);
        if (frame == null) {
            return Lookup.MISSING;
        }
        Object value = frame.get(root);
        for (String component : path) {
            PathResolver.Result result = PathResolver.resolve(value, component);
            if (!result.isFound()) {
                String reason = result.reason() != null ? result.reason() : "no such member";
                throw new PathResolutionException(
                        String.format("Cannot expand token '%s', component '%s' is missing or invalid (%s)",
                                name, component, reason),
                        token.getPosition());
            }
            value = result.value();
        }
        return new Lookup(true, value);
    }

    private static void writeIfPresent(OutputSink out, String text) {
        if (text != null && !text.isEmpty()) {
            out.write(text);
        }
    }

    private record Lookup(boolean found, Object value) {
        static final Lookup MISSING = new Lookup(false, null);
    }
}
