package org.vcad.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.vcad.share.ShareUrlBuilder;

/**
 * Compact IR 服务的 Bean 装配。
 * <p>
 * 编解码器本身是无状态的静态工具，不需要注册为 Bean；这里只装配依赖配置的组件。
 */
@Configuration(proxyBeanMethods = false)
public class CompactIrConfiguration {

    @Bean
    public ShareUrlBuilder shareUrlBuilder(CompactIrProperties properties) {
        return new ShareUrlBuilder(properties.getShareBaseUrl(), properties.getShareUrlWarnLength());
    }
}
