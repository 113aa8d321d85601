package me.golemcore.estate.infrastructure.http;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.estate.infrastructure.config.EstateProperties;
import okhttp3.ConnectionPool;
import okhttp3.Interceptor;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Shared OkHttp client of the worker adapters: Mapbox through Feign, Tavily
 * and the SERP API directly. Sizing comes from
 * {@link EstateProperties.HttpProperties}.
 *
 * <p>
 * Every exchange carries the service's User-Agent and is logged at DEBUG as
 * method, host, path, status and latency. Query strings are left out of the
 * log because Mapbox takes its access token there.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class OkHttpConfig {

    static final String USER_AGENT = "estate-search/1.0";

    private final EstateProperties properties;

    @Bean
    public OkHttpClient okHttpClient() {
        EstateProperties.HttpProperties http = properties.getHttp();
        log.info("[HTTP] client timeouts: connect {}ms, read {}ms, write {}ms; pool of {} idle connections",
                http.getConnectTimeout(), http.getReadTimeout(), http.getWriteTimeout(),
                http.getMaxIdleConnections());

        return new OkHttpClient.Builder()
                .connectTimeout(http.getConnectTimeout(), TimeUnit.MILLISECONDS)
                .readTimeout(http.getReadTimeout(), TimeUnit.MILLISECONDS)
                .writeTimeout(http.getWriteTimeout(), TimeUnit.MILLISECONDS)
                .connectionPool(new ConnectionPool(http.getMaxIdleConnections(), http.getKeepAliveDuration(),
                        TimeUnit.MILLISECONDS))
                .addInterceptor(new ExchangeInterceptor())
                .build();
    }

    static final class ExchangeInterceptor implements Interceptor {

        @Override
        public Response intercept(Chain chain) throws IOException {
            Request request = chain.request();
            if (request.header("User-Agent") == null) {
                request = request.newBuilder().header("User-Agent", USER_AGENT).build();
            }
            long started = System.nanoTime();
            try {
                Response response = chain.proceed(request);
                log.debug("[HTTP] {} {}{} -> {} ({} ms)", request.method(), request.url().host(),
                        request.url().encodedPath(), response.code(), elapsedMillis(started));
                return response;
            } catch (IOException e) {
                log.debug("[HTTP] {} {}{} failed after {} ms: {}", request.method(), request.url().host(),
                        request.url().encodedPath(), elapsedMillis(started), e.getMessage());
                throw e;
            }
        }

        private static long elapsedMillis(long startedNanos) {
            return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
        }
    }
}
