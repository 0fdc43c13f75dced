package me.golemcore.converse.infrastructure.http;

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
import me.golemcore.converse.infrastructure.config.AgentProperties;
import okhttp3.ConnectionPool;
import okhttp3.Interceptor;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Shared {@link OkHttpClient} for the Feign client and the streaming
 * transport, configured from {@code agent.http.*}. Every request carries the
 * configured {@code User-Agent}.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class OkHttpConfig {

    private final AgentProperties properties;

    @Bean
    public OkHttpClient okHttpClient() {
        AgentProperties.HttpProperties http = properties.getHttp();
        log.debug("[Http] Client timeouts: connect={}ms, read={}ms, write={}ms", http.getConnectTimeout(),
                http.getReadTimeout(), http.getWriteTimeout());

        return new OkHttpClient.Builder()
                .addInterceptor(userAgent(http.getUserAgent()))
                .connectTimeout(http.getConnectTimeout(), TimeUnit.MILLISECONDS)
                .readTimeout(http.getReadTimeout(), TimeUnit.MILLISECONDS)
                .writeTimeout(http.getWriteTimeout(), TimeUnit.MILLISECONDS)
                .connectionPool(new ConnectionPool(
                        http.getMaxIdleConnections(),
                        http.getKeepAliveDuration(),
                        TimeUnit.MILLISECONDS))
                .retryOnConnectionFailure(http.isRetryOnConnectionFailure())
                .build();
    }

    static Interceptor userAgent(String userAgent) {
        return chain -> {
            if (userAgent == null || userAgent.isBlank() || chain.request().header("User-Agent") != null) {
                return chain.proceed(chain.request());
            }
            return chain.proceed(chain.request().newBuilder().header("User-Agent", userAgent).build());
        };
    }
}
