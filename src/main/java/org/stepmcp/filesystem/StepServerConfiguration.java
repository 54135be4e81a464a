package org.stepmcp.filesystem;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * STEP 写出服务的 Bean 装配：把 {@link StepServerProperties} 注入到路径解析器与待写入存储中。
 * 不依赖数据库/外部存储，全部基于本地文件系统与内存。
 */
@Configuration(proxyBeanMethods = false)
public class StepServerConfiguration {

    @Bean
    public SecurePathResolver securePathResolver(StepServerProperties properties) {
        return new SecurePathResolver(properties);
    }

    @Bean
    public PendingStepWriteStore pendingStepWriteStore(StepServerProperties properties) {
        return new PendingStepWriteStore(
                properties.getPendingWriteTtl(),
                properties.getPendingWriteMaxBytes().toBytes()
        );
    }
}
