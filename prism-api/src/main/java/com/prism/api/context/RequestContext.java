package com.prism.api.context;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 一次调用链执行的可变上下文
 * <p>
 * 每次 run 创建一个实例，不在多个执行之间共享。
 * 链内步骤严格串行，因此除 sharedState 外的字段不做并发保护。
 * </p>
 *
 * @author Prism
 */
public class RequestContext {

    public static final String ERRORS_KEY = "errors";
    public static final String TRACE_KEY = "_trace";
    public static final String USER_ID_KEY = "user_id";

    private static final long ORIGIN = System.nanoTime();

    @Getter
    private final String route;

    @Getter
    private final Map<String, Object> requestData;

    @Getter
    private Map<String, Object> responseData = new LinkedHashMap<>();

    private final Map<String, Object> sharedState = new ConcurrentHashMap<>();

    /**
     * 追踪日志，未开启时为 null
     */
    private List<String> traceLog;

    @Getter
    private volatile boolean shortCircuited;

    @Getter
    @Setter
    private String currentPluginName;

    @Getter
    @Setter
    private String userId;

    public RequestContext(String route, Map<String, Object> requestData) {
        this.route = route;
        this.requestData = requestData == null ? new LinkedHashMap<>() : new LinkedHashMap<>(requestData);
        Object uid = this.requestData.get(USER_ID_KEY);
        if (uid != null) {
            this.userId = String.valueOf(uid);
        }
    }

    // ==================== 追踪 ====================

    public void enableTrace() {
        if (traceLog == null) {
            traceLog = new ArrayList<>();
        }
    }

    public boolean isTracing() {
        return traceLog != null;
    }

    /**
     * 追加一条带单调时间戳的追踪记录，未开启追踪时不做任何事
     */
    public void addTrace(String message) {
        if (traceLog == null) {
            return;
        }
        double seconds = (System.nanoTime() - ORIGIN) / 1_000_000_000.0;
        traceLog.add(String.format(Locale.ROOT, "[%.4f] %s", seconds, message));
    }

    /**
     * @return 追踪日志只读视图；未开启追踪时为 null
     */
    public List<String> getTraceLog() {
        return traceLog == null ? null : Collections.unmodifiableList(traceLog);
    }

    // ==================== 响应 ====================

    /**
     * 设置响应数据并短路
     */
    public void respond(Map<String, Object> data) {
        this.responseData = data == null ? new LinkedHashMap<>() : new LinkedHashMap<>(data);
        shortCircuit();
    }

    /**
     * 设置错误响应并短路
     */
    public void error(String message) {
        this.responseData = new LinkedHashMap<>();
        this.responseData.put("error", message);
        shortCircuit();
    }

    public void shortCircuit() {
        this.shortCircuited = true;
    }

    /**
     * 在 responseData.errors 中追加一条 {plugin, error}
     */
    @SuppressWarnings("unchecked")
    public void addError(String pluginName, String message) {
        Object existing = responseData.get(ERRORS_KEY);
        List<Map<String, Object>> errors;
        if (existing instanceof List<?>) {
            errors = (List<Map<String, Object>>) existing;
        } else {
            errors = new ArrayList<>();
            responseData.put(ERRORS_KEY, errors);
        }
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("plugin", pluginName);
        entry.put("error", message);
        errors.add(entry);
    }

    // ==================== 共享状态 ====================

    public void set(String key, Object value) {
        if (value == null) {
            sharedState.remove(key);
        } else {
            sharedState.put(key, value);
        }
    }

    @SuppressWarnings("unchecked")
    public <T> T get(String key) {
        return (T) sharedState.get(key);
    }

    @SuppressWarnings("unchecked")
    public <T> T get(String key, T defaultValue) {
        Object value = sharedState.get(key);
        return value == null ? defaultValue : (T) value;
    }
}
