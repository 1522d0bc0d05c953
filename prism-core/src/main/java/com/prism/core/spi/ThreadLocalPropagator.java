package com.prism.core.spi;

/**
 * 上下文传播器 SPI
 * 用于在跨线程提交任务时，搬运 ThreadLocal 数据（例如当前插件身份）
 */
public interface ThreadLocalPropagator<T> {

    /**
     * 在提交线程（调用方）捕获当前状态
     */
    T capture();

    /**
     * 在执行线程重放 capture 得到的状态
     *
     * @return 执行线程原有的状态，用于后续 restore
     */
    T replay(T snapshot);

    /**
     * 在执行线程恢复 replay 之前的状态
     */
    void restore(T backup);
}
