package com.prism.core.chain;

import java.util.List;

/**
 * 路由调用链的校验结果
 */
public record ChainValidation(String route, List<String> chain, boolean valid, List<String> issues) {

    public ChainValidation {
        chain = List.copyOf(chain);
        issues = List.copyOf(issues);
    }
}
