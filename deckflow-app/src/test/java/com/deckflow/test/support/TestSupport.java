package com.deckflow.test.support;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.support.StaticListableBeanFactory;

import java.time.Duration;
import java.util.function.BooleanSupplier;

/**
 * 测试公共方法。
 */
public final class TestSupport {

    private TestSupport() {
    }

    public static ObjectProvider<MeterRegistry> meterRegistryProvider(MeterRegistry registry) {
        StaticListableBeanFactory beanFactory = new StaticListableBeanFactory();
        beanFactory.addBean("meterRegistry", registry);
        return beanFactory.getBeanProvider(MeterRegistry.class);
    }

    /**
     * 轮询等待条件成立，超时返回 false。
     */
    public static boolean await(BooleanSupplier condition, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            try {
                Thread.sleep(10L);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return condition.getAsBoolean();
    }
}
