package com.coparent.service.push;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@ConditionalOnProperty(prefix = "coparent.push", name = "provider", havingValue = "log", matchIfMissing = true)
public class LoggingPushGateway implements PushGateway {

    @Override
    public PushResult send(PushMessage message) {
        log.info("Push to {} device(s): {} - {} {}", message.getTokens().size(),
                message.getTitle(), message.getBody(), message.getData());
        return PushResult.builder().successCount(message.getTokens().size()).build();
    }
}
