package com.dev.prostaff.config;

import com.dev.prostaff.realtime.ChannelDestinations;
import com.dev.prostaff.realtime.ChannelErrorHandler;
import com.dev.prostaff.realtime.ChannelSubscriptionInterceptor;
import com.dev.prostaff.realtime.IdentityHandshakeHandler;
import com.dev.prostaff.realtime.TokenHandshakeInterceptor;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.ChannelRegistration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

@Configuration
@EnableWebSocketMessageBroker
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

    private final RealtimeProperties properties;
    private final TokenHandshakeInterceptor tokenHandshakeInterceptor;
    private final ChannelSubscriptionInterceptor channelSubscriptionInterceptor;
    private final ObjectMapper objectMapper;

    public WebSocketConfig(RealtimeProperties properties,
                           TokenHandshakeInterceptor tokenHandshakeInterceptor,
                           ChannelSubscriptionInterceptor channelSubscriptionInterceptor,
                           ObjectMapper objectMapper) {
        this.properties = properties;
        this.tokenHandshakeInterceptor = tokenHandshakeInterceptor;
        this.channelSubscriptionInterceptor = channelSubscriptionInterceptor;
        this.objectMapper = objectMapper;
    }

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        registry.addEndpoint(properties.endpoint())
                .setAllowedOriginPatterns(properties.allowedOrigins().toArray(String[]::new))
                .setHandshakeHandler(new IdentityHandshakeHandler())
                .addInterceptors(tokenHandshakeInterceptor);
        registry.setErrorHandler(new ChannelErrorHandler(objectMapper));
    }

    @Override
    public void configureMessageBroker(MessageBrokerRegistry registry) {
        registry.enableSimpleBroker("/topic", "/queue");
        registry.setApplicationDestinationPrefixes(ChannelDestinations.APPLICATION_PREFIX);
        registry.setUserDestinationPrefix("/user");
    }

    @Override
    public void configureClientInboundChannel(ChannelRegistration registration) {
        registration.interceptors(channelSubscriptionInterceptor);
    }
}
