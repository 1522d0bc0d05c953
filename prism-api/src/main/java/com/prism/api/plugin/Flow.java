package com.prism.api.plugin;

/**
 * 调用链步骤的流转结果
 */
public enum Flow {
    /**
     * 继续执行下一个插件
     */
    NEXT,
    /**
     * 结束调用链（不视为短路，不记录错误）
     */
    END
}
