package com.github.tubetune.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.CookieJar;
import okhttp3.Interceptor;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.jetbrains.annotations.NotNull;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Shared HTTP client. Calls are not retried: a failed call fails its strategy
 * or its transfer.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class HttpClientConfig {

    private final TubeTuneProperties properties;

    @Bean
    public OkHttpClient okHttpClient() {
        Duration timeout = properties.getExtractor().getStrategyTimeout();
        return new OkHttpClient.Builder()
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .writeTimeout(timeout)
                .addInterceptor(new BrowserHeadersInterceptor())
                .cookieJar(cookieJar())
                .followRedirects(true)
                .followSslRedirects(true)
                .build();
    }

    private CookieJar cookieJar() {
        if (!properties.getExtractor().hasCookies()) {
            return new NetscapeCookieJar();
        }
        return NetscapeCookieJar.fromFile(Path.of(properties.getExtractor().getCookiesFile()));
    }

    /**
     * Interceptor presenting browser-like headers unless the request already sets them
     */
    private class BrowserHeadersInterceptor implements Interceptor {

        @NotNull
        @Override
        public Response intercept(@NotNull Chain chain) throws IOException {
            Request original = chain.request();

            // NOTE: Don't set Accept-Encoding manually - OkHttp handles compression automatically
            Request.Builder builder = original.newBuilder();
            setIfAbsent(original, builder, "User-Agent", properties.getExtractor().getUserAgent());
            setIfAbsent(original, builder, "Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8");
            setIfAbsent(original, builder, "Accept-Language", "en-US,en;q=0.5");

            Response response = chain.proceed(builder.build());

            if (response.code() == 429) {
                log.warn("Rate limited by {}", original.url().host());
            }

            return response;
        }

        private void setIfAbsent(Request original, Request.Builder builder, String name, String value) {
            if (original.header(name) == null) {
                builder.header(name, value);
            }
        }
    }
}
