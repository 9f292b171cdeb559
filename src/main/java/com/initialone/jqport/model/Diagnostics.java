package com.initialone.jqport.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 单次转换内的诊断收集器：只追加，不删除。
 * 每次 convert 新建一个实例，不跨线程共享。
 */
public class Diagnostics {
    private final List<Diagnostic> items = new ArrayList<>();

    public void info(int line, String message) {
        items.add(new Diagnostic(line, Severity.INFO, message));
    }

    public void warning(int line, String message) {
        items.add(new Diagnostic(line, Severity.WARNING, message));
    }

    public void blocked(int line, String message) {
        items.add(new Diagnostic(line, Severity.BLOCKED, message));
    }

    public int size() {
        return items.size();
    }

    public long count(Severity severity) {
        return items.stream().filter(d -> d.severity == severity).count();
    }

    /** 当前快照（不可修改） */
    public List<Diagnostic> snapshot() {
        return Collections.unmodifiableList(new ArrayList<>(items));
    }
}
