package com.initialone.jqport.symbols;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Objects;

/**
 * What happens to one source call: renamed to {@link #target} (with argument fixes), or removed
 * and replaced by {@link #placeholder} where its value is used.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class CallRule {
    public final String source;
    /** null 表示目标平台没有对应接口（REMOVE） */
    public final String target;
    public final String placeholder;
    public final List<ArgFix> fixes;
    /** 定时任务注册：第一个位置参数是回调函数名 */
    public final boolean schedule;
    public final String warning;

    private CallRule(String source, String target, String placeholder, List<ArgFix> fixes,
                     boolean schedule, String warning) {
        this.source = Objects.requireNonNull(source);
        this.target = target;
        this.placeholder = placeholder;
        this.fixes = List.copyOf(fixes);
        this.schedule = schedule;
        this.warning = warning;
    }

    public static CallRule mapped(String source, String target, List<ArgFix> fixes, boolean schedule, String warning) {
        return new CallRule(source, Objects.requireNonNull(target), null, fixes, schedule, warning);
    }

    public static CallRule removed(String source, String placeholder, boolean schedule, String warning) {
        return new CallRule(source, null, placeholder == null ? "None" : placeholder, List.of(), schedule, warning);
    }

    public boolean isRemoved() {
        return target == null;
    }

    @Override
    public String toString() {
        return source + " -> " + (isRemoved() ? "REMOVE(" + placeholder + ")" : target + (fixes.isEmpty() ? "" : " " + fixes));
    }
}
