package io.lighting.mongosql.observe;

import io.lighting.mongosql.command.CompiledCommand;
import io.lighting.mongosql.sql.Bindings;

/**
 * 编译过程观察器。
 * <p>
 * 监听一条语句从解析到生成 MongoDB 命令的生命周期，便于实现日志、指标、审计等横切能力。
 * 各回调方法均提供默认空实现，按需覆盖即可。
 * <p>
 * 正常情况下依次触发 {@link #beforeCompile} 与 {@link #afterCompile}；
 * 若编译失败，则在异常抛出前触发 {@link #onCompileError}。
 * <p>
 * 实现类若持有状态，应自行保证线程安全。
 */
public interface CompileObserver {
    /**
     * 编译前回调。
     *
     * @param sql      语句原文
     * @param bindings 本次编译的参数
     */
    default void beforeCompile(String sql, Bindings bindings) {
    }

    /**
     * 编译成功回调。
     *
     * @param sql          语句原文
     * @param bindings     本次编译的参数
     * @param command      生成的命令
     * @param elapsedNanos 编译耗时（纳秒）
     */
    default void afterCompile(String sql, Bindings bindings, CompiledCommand command, long elapsedNanos) {
    }

    /**
     * 编译失败回调。
     *
     * @param sql          语句原文
     * @param bindings     本次编译的参数
     * @param error        编译异常
     * @param elapsedNanos 编译耗时（纳秒）
     */
    default void onCompileError(String sql, Bindings bindings, RuntimeException error, long elapsedNanos) {
    }
}
