package me.golemcore.estate.infrastructure.config;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.estate.port.inbound.ChannelPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

/**
 * Spring configuration that provides shared beans and runs the lifecycle of
 * the channels: every discovered {@link ChannelPort} is started on application
 * startup and stopped on shutdown.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final EstateProperties properties;
    private final List<ChannelPort> channelPorts;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @PostConstruct
    public void init() {
        EstateProperties.TurnProperties turn = properties.getTurn();
        log.info("Estate search coordinator starting...");
        log.info("LLM: {} @ {}", properties.getLlm().getModel(), properties.getLlm().getBaseUrl());
        log.info("Fan-out cap: {}, POI cascade: {}, stage timeout: {}s",
                turn.getFanOutCap(), turn.isPoiEnabled(), turn.getStageTimeoutSeconds());

        for (ChannelPort channel : channelPorts) {
            log.info("Starting channel: {}", channel.getChannelType());
            channel.start();
        }

        log.info("Estate search coordinator started");
    }

    @PreDestroy
    public void shutdown() {
        for (ChannelPort channel : channelPorts) {
            if (channel.isRunning()) {
                log.info("Stopping channel: {}", channel.getChannelType());
                channel.stop();
            }
        }
    }
}
