package com.deckflow;

import org.springframework.beans.factory.annotation.Configurable;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 演示文稿工作流服务启动类。
 * <p>
 * Application 类位于顶层包路径，确保能够扫描到所有子模块中的组件。
 * </p>
 *
 * @author deckflow
 * @since 2026-10-19
 */
@SpringBootApplication
@Configurable
public class Application {

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }

}
