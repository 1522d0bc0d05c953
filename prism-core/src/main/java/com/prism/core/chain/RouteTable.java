package com.prism.core.chain;

import java.util.List;
import java.util.Set;

/**
 * 路由表：路由 -> 有序的插件引用
 */
public interface RouteTable {

    /**
     * @return 未配置时返回空列表
     */
    List<String> getChain(String route);

    Set<String> routes();
}
