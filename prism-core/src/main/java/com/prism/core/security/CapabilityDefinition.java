package com.prism.core.security;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.util.Set;
import java.util.function.Predicate;

/**
 * 能力定义：进程启动时注册，之后不可变
 */
@Getter
@Builder
@ToString(exclude = "resourceMatcher")
public final class CapabilityDefinition {

    /**
     * 点分名称，例如 file.read.plugin
     */
    private final String name;

    private final String description;

    /**
     * 清单/锁文件中声明的类型，例如 file、network
     */
    private final String type;

    /**
     * 与声明中 resource 匹配的通配符；为 null 时匹配任意声明
     */
    private final String resourcePattern;

    /**
     * 精确匹配的受控事件
     */
    @Singular("event")
    private final Set<String> events;

    /**
     * 前缀匹配的受控事件
     */
    @Singular("eventPrefix")
    private final Set<String> eventPrefixes;

    /**
     * 执行期资源判定，入参为从事件参数中提取的判别值；为 null 时总是接受
     */
    private final Predicate<Object> resourceMatcher;

    public boolean governsExactly(String event) {
        return events.contains(event);
    }

    public boolean governsByPrefix(String event) {
        for (String prefix : eventPrefixes) {
            if (event.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    public boolean acceptsResource(Object discriminator) {
        return resourceMatcher == null || resourceMatcher.test(discriminator);
    }

    /**
     * 声明 (type, resource) 是否落在本定义之下
     */
    public boolean matchesDeclaration(String declaredType, String declaredResource) {
        if (!type.equals(declaredType)) {
            return false;
        }
        if (resourcePattern == null) {
            return true;
        }
        return GlobMatcher.matches(declaredResource, resourcePattern);
    }
}
