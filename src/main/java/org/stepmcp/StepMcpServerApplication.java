package org.stepmcp;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@SpringBootApplication
@ConfigurationPropertiesScan
public class StepMcpServerApplication {

    public static void main(String[] args) {
        ensureLogDirectory();
        SpringApplication.run(StepMcpServerApplication.class, args);
    }

    /**
     * 提前创建日志目录（logback 的 RollingFileAppender 不会自动创建）。
     * <p>
     * 与 logback-spring.xml 一致：优先系统属性/环境变量 LOG_PATH，默认 ./logs。
     * stdio 模式下 stdout 只能输出协议报文，失败信息写到 stderr。
     */
    private static void ensureLogDirectory() {
        String logPath = System.getProperty("LOG_PATH");
        if (logPath == null || logPath.isBlank()) {
            logPath = System.getenv("LOG_PATH");
        }
        if (logPath == null || logPath.isBlank()) {
            logPath = "logs";
        }
        try {
            Files.createDirectories(Path.of(logPath));
        } catch (IOException e) {
            System.err.println("创建日志目录失败：" + logPath + "（" + e.getMessage() + "）");
        }
    }
}
