package com.prism.api.exception;

/**
 * 沙箱基础设施异常（例如审计钩子安装失败），属于结构性错误
 */
public class SandboxException extends PrismException {

    public SandboxException(String message) {
        super(message);
    }
}
