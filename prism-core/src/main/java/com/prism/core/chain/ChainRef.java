package com.prism.core.chain;

import com.prism.api.exception.ConfigurationException;

/**
 * 调用链中的一项引用
 * <ul>
 *     <li>{@code name}：普通插件</li>
 *     <li>{@code group.sub}：插件组的子插件，执行时才解析</li>
 *     <li>{@code group:chain}：插件组的预设链，解析时展开</li>
 * </ul>
 */
public sealed interface ChainRef {

    /**
     * 配置中的原始写法
     */
    String raw();

    static ChainRef parse(String ref) {
        if (ref == null || ref.isBlank()) {
            throw new ConfigurationException("Chain reference must not be empty");
        }
        String value = ref.trim();
        int colon = value.indexOf(':');
        if (colon > 0 && colon < value.length() - 1 && !value.startsWith("http")) {
            return new Preset(value.substring(0, colon), value.substring(colon + 1));
        }
        int dot = value.indexOf('.');
        if (dot > 0 && dot < value.length() - 1) {
            return new SubPlugin(value.substring(0, dot), value.substring(dot + 1));
        }
        return new Plain(value);
    }

    record Plain(String name) implements ChainRef {
        @Override
        public String raw() {
            return name;
        }
    }

    record SubPlugin(String group, String subName) implements ChainRef {
        @Override
        public String raw() {
            return group + "." + subName;
        }
    }

    record Preset(String group, String chainName) implements ChainRef {
        @Override
        public String raw() {
            return group + ":" + chainName;
        }
    }
}
