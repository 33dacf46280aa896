package com.openclaw.wechat.channel.plugin;

import com.openclaw.wechat.common.config.ConfigService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration for the WeChat channel. The host supplies a
 * {@link ConfigService} and {@link WeChatCollaborators} bean; accounts are
 * stopped when the context closes.
 */
@Slf4j
@Configuration
public class WeChatBeanConfig implements DisposableBean {

    private final ConfigService configService;
    private final WeChatCollaborators collaborators;
    private WeChatContext context;

    public WeChatBeanConfig(ConfigService configService, WeChatCollaborators collaborators) {
        this.configService = configService;
        this.collaborators = collaborators;
    }

    @Bean
    public WeChatContext wechatContext() {
        if (context == null) {
            context = WeChatChannelPlugin.initialize(configService, collaborators);
        }
        return context;
    }

    @Override
    public void destroy() {
        if (context != null) {
            context.close();
        }
    }
}
