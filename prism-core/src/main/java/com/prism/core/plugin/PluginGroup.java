package com.prism.core.plugin;

import com.prism.api.context.RequestContext;
import com.prism.api.plugin.Flow;
import com.prism.api.plugin.PrismPlugin;
import lombok.Getter;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 插件组（元插件）：拥有一组子插件与命名预设调用链
 * <p>
 * 子插件共享组的锁文件与身份，以组名作为拦截作用域。
 * </p>
 */
public class PluginGroup {

    /**
     * 预设链中表示 "后续插件" 的占位符，展开时跳过
     */
    public static final String NEXT_PLACEHOLDER = "__NEXT__";

    @Getter
    private final String name;

    private final Map<String, SubPlugin> subPlugins;

    private final Map<String, ChainPreset> presets;

    public PluginGroup(String name, Map<String, SubPlugin> subPlugins, Map<String, ChainPreset> presets) {
        this.name = name;
        this.subPlugins = Collections.unmodifiableMap(new LinkedHashMap<>(subPlugins));
        this.presets = Collections.unmodifiableMap(new LinkedHashMap<>(presets));
    }

    public Optional<SubPlugin> getSubPlugin(String subName) {
        return Optional.ofNullable(subPlugins.get(subName));
    }

    /**
     * 按加载顺序排列的子插件
     */
    public Map<String, SubPlugin> getSubPlugins() {
        return subPlugins;
    }

    public Optional<ChainPreset> getPreset(String chainName) {
        return Optional.ofNullable(presets.get(chainName));
    }

    public Map<String, ChainPreset> getPresets() {
        return presets;
    }

    /**
     * @param name     子插件短名
     * @param fullName 组名.子插件名
     */
    public record SubPlugin(String name, String fullName, Path directory, PrismPlugin instance) {
    }

    /**
     * @param name    预设名
     * @param plugins 插件引用，子插件已展开为 "组名.子插件名"，可能包含 {@link #NEXT_PLACEHOLDER}
     */
    public record ChainPreset(String name, String description, List<String> plugins) {

        public ChainPreset {
            plugins = List.copyOf(plugins);
        }
    }

    /**
     * 未注册入口的组本身
     */
    static final class PassThrough implements PrismPlugin {

        @Override
        public Flow handle(RequestContext context) {
            return Flow.NEXT;
        }
    }
}
