package com.initialone.jqport.symbols;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** JSON shape of a built-in variant table: /variants/&lt;id&gt;.json */
public class VariantDefinition {
    /** 继承的父变体 id，可为空 */
    public String inherits;
    /** 结构模板名：/templates/&lt;template&gt;.py */
    public String template;
    public Boolean collapseSchedules;
    /** 周期槽位；"" 表示该变体没有周期槽位 */
    public String periodicSlot;
    public String globalObject;
    public String contextName;
    public Map<String, RuleDefinition> calls = new LinkedHashMap<>();
    public List<String> removedImports;
    public Map<String, String> literalRewrites;
    public List<String> registrationCalls;

    public static class RuleDefinition {
        public String target;
        public boolean remove;
        /** 子变体用来取消父变体中的规则：原样保留调用 */
        public boolean passThrough;
        public String placeholder;
        public List<FixDefinition> fixes = new ArrayList<>();
        public boolean schedule;
        public String warning;
    }

    public static class FixDefinition {
        public String op;
        public String value;
        public Integer index;
        public String name;
        public String from;
        public String to;
        public int[] order;
        public Map<String, String> values;
    }
}
