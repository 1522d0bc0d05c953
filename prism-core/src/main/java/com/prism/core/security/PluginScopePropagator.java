package com.prism.core.security;

import com.prism.core.spi.ThreadLocalPropagator;

/**
 * 将插件身份搬运到执行线程
 */
public class PluginScopePropagator implements ThreadLocalPropagator<String> {

    @Override
    public String capture() {
        return PluginScope.current();
    }

    @Override
    public String replay(String snapshot) {
        return PluginScope.enter(snapshot);
    }

    @Override
    public void restore(String backup) {
        PluginScope.restore(backup);
    }
}
