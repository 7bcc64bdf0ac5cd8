package io.lighting.mongosql.observe;

import io.lighting.mongosql.command.CompiledCommand;
import io.lighting.mongosql.sql.Bindings;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 编译日志观察器。
 * <p>
 * 每次编译成功输出一行：{@code 前缀 [类型] 语句 => 命令JSON}，
 * 可选附带参数与耗时；编译失败时以 WARN 级别输出原因。
 * <p>
 * 通过 {@link Builder} 配置，构建后为不可变对象，线程安全。
 */
public final class CompileLog implements CompileObserver {
    private static final Logger LOGGER = LoggerFactory.getLogger(CompileLog.class);

    /**
     * 总开关。为 false 时不输出任何日志。
     */
    private final boolean enabled;
    /**
     * 是否包含耗时信息（纳秒）。
     */
    private final boolean includeElapsed;
    /**
     * 是否包含绑定参数。
     */
    private final boolean includeParameters;
    /**
     * 日志前缀，用于快速识别日志来源。
     */
    private final String prefix;
    /**
     * 日志输出目标，默认输出到 SLF4J（INFO）。
     */
    private final Consumer<String> sink;

    private CompileLog(Builder builder) {
        this.enabled = builder.enabled;
        this.includeElapsed = builder.includeElapsed;
        this.includeParameters = builder.includeParameters;
        this.prefix = builder.prefix;
        this.sink = builder.sink;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public void afterCompile(String sql, Bindings bindings, CompiledCommand command, long elapsedNanos) {
        if (!enabled) {
            return;
        }
        sink.accept(format(sql, bindings, command, elapsedNanos));
    }

    @Override
    public void onCompileError(String sql, Bindings bindings, RuntimeException error, long elapsedNanos) {
        if (!enabled) {
            return;
        }
        LOGGER.warn("{} failed to compile [{}]: {}", prefix, singleLine(sql), error.getMessage());
    }

    String format(String sql, Bindings bindings, CompiledCommand command, long elapsedNanos) {
        StringBuilder line = new StringBuilder();
        line.append(prefix)
            .append(" [")
            .append(command.kind().name())
            .append("] ")
            .append(singleLine(sql))
            .append(" => ")
            .append(command.toJson());
        List<String> details = new ArrayList<>();
        if (includeParameters && !bindings.isEmpty()) {
            if (!bindings.named().isEmpty()) {
                details.add("named=" + bindings.named());
            }
            if (!bindings.positional().isEmpty()) {
                details.add("positional=" + bindings.positional());
            }
        }
        if (includeElapsed) {
            details.add("elapsed=" + elapsedNanos + "ns");
        }
        if (!details.isEmpty()) {
            line.append(" | ").append(String.join(", ", details));
        }
        return line.toString();
    }

    /**
     * 将多行语句压缩为一行，便于日志检索。
     */
    private static String singleLine(String sql) {
        return sql.strip().replaceAll("\\s+", " ");
    }

    public static final class Builder {
        private boolean enabled = true;
        private boolean includeElapsed = false;
        private boolean includeParameters = false;
        private String prefix = "MQL:";
        private Consumer<String> sink = LOGGER::info;

        private Builder() {
        }

        /**
         * 全局开关：关闭后不输出任何日志。
         */
        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder includeElapsed(boolean enabled) {
            this.includeElapsed = enabled;
            return this;
        }

        /**
         * 是否输出绑定参数。参数可能包含敏感数据，默认关闭。
         */
        public Builder includeParameters(boolean enabled) {
            this.includeParameters = enabled;
            return this;
        }

        public Builder prefix(String prefix) {
            if (prefix == null || prefix.isBlank()) {
                throw new IllegalArgumentException("prefix must not be blank");
            }
            this.prefix = prefix;
            return this;
        }

        /**
         * 设置日志输出目标，例如绑定到应用自己的 Logger。
         */
        public Builder sink(Consumer<String> sink) {
            this.sink = Objects.requireNonNull(sink, "sink");
            return this;
        }

        public CompileLog build() {
            return new CompileLog(this);
        }
    }
}
